package com.ivamare.eventsourcing.pipeline;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Ordered list of middlewares terminating in a handler invocation.
 *
 * <p>Middlewares run in registration order, the first registered being the outermost.
 *
 * @param <R> request type
 */
public class MiddlewareChain<R> {

    /**
     * Innermost step: resolves and invokes the handler.
     */
    @FunctionalInterface
    public interface Terminal<R> {

        Object invoke(R request) throws Exception;
    }

    private final List<Middleware<R>> middlewares = new CopyOnWriteArrayList<>();

    public void add(Middleware<R> middleware) {
        middlewares.add(middleware);
    }

    public int size() {
        return middlewares.size();
    }

    public Object execute(R request, Terminal<R> terminal) throws Exception {
        return invoke(List.copyOf(middlewares), 0, request, terminal);
    }

    private Object invoke(List<Middleware<R>> snapshot, int index, R request, Terminal<R> terminal)
            throws Exception {
        if (index == snapshot.size()) {
            return terminal.invoke(request);
        }
        return snapshot.get(index).handle(request, () -> invoke(snapshot, index + 1, request, terminal));
    }
}
