package com.temenos.store;

import java.util.List;
import java.util.concurrent.Callable;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Store calls block on disk and crypto, so services hop them onto the bounded elastic
 * scheduler instead of running them on a Netty event loop.
 */
public final class Blocking {

    private Blocking() {}

    public static <T> Mono<T> mono(Callable<T> call) {
        return Mono.fromCallable(call).subscribeOn(Schedulers.boundedElastic());
    }

    public static <T> Flux<T> flux(Callable<List<T>> call) {
        return mono(call).flatMapIterable(list -> list);
    }

    public static Mono<Void> run(Runnable action) {
        return Mono.fromRunnable(action).subscribeOn(Schedulers.boundedElastic()).then();
    }
}
