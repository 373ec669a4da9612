package com.lwactors.internal;

import com.lwactors.Result;

import java.util.concurrent.CompletableFuture;

/**
 * An action paired with the reply slot its outcome goes to.
 */
record Envelope<A, R, E>(A action, CompletableFuture<Result<R, E>> reply) {
}
