/*
 * Copyright (c) 2008-2022 the original author or authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.channelgate.gateway;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * <p>The future result of an operation, in callback style.</p>
 * <p>Gateway operations that may suspend, such as authenticating a subscription
 * to a private channel, do not return their result: they complete the
 * {@code Promise} passed as parameter, possibly from a different thread.</p>
 *
 * @param <C> the type of the result value
 */
public interface Promise<C> {
    /**
     * <p>A promise that ignores both outcomes; prefer {@link #noop()}
     * when a typed reference is needed.</p>
     */
    Promise<?> NOOP = new Promise<Object>() {
    };

    /**
     * <p>Completes this promise with the given result.</p>
     *
     * @param result the outcome of the operation
     * @see #fail(Throwable)
     */
    default void succeed(C result) {
    }

    /**
     * <p>Completes this promise with the given failure.</p>
     *
     * @param failure the reason why the operation could not complete
     */
    default void fail(Throwable failure) {
    }

    /**
     * <p>Used by callers that do not care about the outcome, for example
     * {@code join(socket, request)} without promise.</p>
     *
     * @param <T> the result type expected by the caller
     * @return the shared {@link #NOOP} promise
     */
    @SuppressWarnings("unchecked")
    static <T> Promise<T> noop() {
        return (Promise<T>)NOOP;
    }

    /**
     * <p>Adapts a pair of lambdas to a promise.</p>
     *
     * @param succeed receives the result
     * @param fail    receives the failure
     * @param <T>     the result type
     * @return a promise forwarding each outcome to its consumer
     */
    static <T> Promise<T> from(Consumer<T> succeed, Consumer<Throwable> fail) {
        return new Promise<T>() {
            @Override
            public void succeed(T result) {
                succeed.accept(result);
            }

            @Override
            public void fail(Throwable failure) {
                fail.accept(failure);
            }
        };
    }

    /**
     * <p>A promise backed by a {@link CompletableFuture}, so that callers
     * can block on the outcome or chain further stages.</p>
     *
     * @param <S> the result type
     */
    class Completable<S> extends CompletableFuture<S> implements Promise<S> {
        @Override
        public void succeed(S result) {
            complete(result);
        }

        @Override
        public void fail(Throwable failure) {
            completeExceptionally(failure);
        }
    }
}
