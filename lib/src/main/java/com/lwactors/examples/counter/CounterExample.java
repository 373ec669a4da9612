package com.lwactors.examples.counter;

import com.lwactors.Reply;
import com.lwactors.Result;
import com.lwactors.config.ThreadPoolFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

/**
 * Two threads hammering one counter: one adds 0..99, the other subtracts 0..99.
 * Every update goes through the counter's mailbox, so the final value is 0.
 */
public class CounterExample {
    private static final Logger logger = LoggerFactory.getLogger(CounterExample.class);

    public static void main(String[] args) throws InterruptedException {
        ExecutorService pool = new ThreadPoolFactory().createExecutorService("counter");
        try (Counter counter = Counter.start(pool)) {
            Counter adder = counter.clone();
            Counter subtractor = counter.clone();

            Thread a = new Thread(() -> {
                try (adder) {
                    List<Reply<Long, CounterError>> replies = LongStream.range(0, 100)
                            .mapToObj(adder::add)
                            .collect(Collectors.toList());
                    logger.info("ADD RESULTS: {}", awaitAll(replies));
                }
            }, "adder");
            Thread b = new Thread(() -> {
                try (subtractor) {
                    List<Reply<Long, CounterError>> replies = LongStream.range(0, 100)
                            .mapToObj(subtractor::subtract)
                            .collect(Collectors.toList());
                    logger.info("SUB RESULTS: {}", awaitAll(replies));
                }
            }, "subtractor");

            a.start();
            b.start();
            a.join();
            b.join();

            logger.info("Finished, counter value: {}", counter.value().get());
        } finally {
            pool.shutdown();
        }
    }

    private static List<Result<Long, CounterError>> awaitAll(List<Reply<Long, CounterError>> replies) {
        return replies.stream().map(reply -> reply.await()).collect(Collectors.toList());
    }
}
