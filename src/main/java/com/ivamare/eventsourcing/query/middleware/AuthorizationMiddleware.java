package com.ivamare.eventsourcing.query.middleware;

import com.ivamare.eventsourcing.exception.UnauthorizedException;
import com.ivamare.eventsourcing.query.Query;
import com.ivamare.eventsourcing.query.QueryMiddleware;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rejects queries without an actor identity.
 */
public class AuthorizationMiddleware implements QueryMiddleware {

    private static final Logger log = LoggerFactory.getLogger(AuthorizationMiddleware.class);

    @Override
    public Object handle(Query query, Next next) throws Exception {
        if (!query.metadata().hasActor()) {
            log.warn("Unauthorized query attempt: {}", query.queryType());
            throw new UnauthorizedException("Unauthorized: actor id required for query " + query.queryType());
        }
        return next.proceed();
    }
}
