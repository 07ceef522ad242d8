package com.ivamare.eventsourcing.command.middleware;

import com.ivamare.eventsourcing.command.Command;
import com.ivamare.eventsourcing.command.CommandMiddleware;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Runs the rest of the pipeline in one transaction.
 *
 * <p>The active {@link TransactionStatus} is exposed to handlers as the
 * {@link #TRANSACTION_ATTRIBUTE} command attribute. Any exception rolls back.
 */
public class TransactionalMiddleware implements CommandMiddleware {

    public static final String TRANSACTION_ATTRIBUTE = "transaction";

    private final TransactionTemplate transactionTemplate;

    public TransactionalMiddleware(TransactionTemplate transactionTemplate) {
        this.transactionTemplate = transactionTemplate;
    }

    @Override
    public Object handle(Command command, Next next) throws Exception {
        try {
            return transactionTemplate.execute(status -> {
                command.setAttribute(TRANSACTION_ATTRIBUTE, status);
                try {
                    return next.proceed();
                } catch (RuntimeException e) {
                    throw e;
                } catch (Exception e) {
                    throw new CheckedFailure(e);
                }
            });
        } catch (CheckedFailure e) {
            throw e.checked;
        } finally {
            command.removeAttribute(TRANSACTION_ATTRIBUTE);
        }
    }

    /**
     * Carries a checked exception through the transaction callback so that it rolls back.
     */
    private static final class CheckedFailure extends RuntimeException {

        private final Exception checked;

        private CheckedFailure(Exception checked) {
            super(checked);
            this.checked = checked;
        }
    }
}
