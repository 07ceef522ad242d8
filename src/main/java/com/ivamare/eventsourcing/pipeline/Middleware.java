package com.ivamare.eventsourcing.pipeline;

/**
 * One step of a request pipeline.
 *
 * <p>A middleware either calls {@link Next#proceed()} to continue down the chain, possibly
 * more than once, or returns/throws without calling it to short-circuit the request.
 *
 * @param <R> request type
 */
@FunctionalInterface
public interface Middleware<R> {

    Object handle(R request, Next next) throws Exception;

    /**
     * Continuation to the rest of the chain, ending at the handler.
     */
    @FunctionalInterface
    interface Next {

        Object proceed() throws Exception;
    }
}
