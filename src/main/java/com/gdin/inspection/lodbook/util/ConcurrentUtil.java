package com.gdin.inspection.lodbook.util;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Function;

public class ConcurrentUtil {

    private ConcurrentUtil() {
    }

    /**
     * 用固定大小线程池逐项执行 fn，结果按输入顺序返回。
     * 每一项只交给一个线程处理；任务抛出的 RuntimeException 原样抛出。
     */
    public static <T, R> List<R> mapInOrder(List<T> items, int concurrency, Function<T, R> fn) {
        List<R> results = new ArrayList<>(items.size());
        if (items.isEmpty()) return results;

        if (concurrency <= 1) {
            for (T item : items) {
                results.add(fn.apply(item));
            }
            return results;
        }

        ExecutorService pool = Executors.newFixedThreadPool(Math.min(concurrency, items.size()));
        try {
            List<CompletableFuture<R>> futures = new ArrayList<>();
            for (T item : items) {
                futures.add(CompletableFuture.supplyAsync(() -> fn.apply(item), pool));
            }
            for (CompletableFuture<R> future : futures) {
                try {
                    results.add(future.join());
                } catch (CompletionException e) {
                    if (e.getCause() instanceof RuntimeException) throw (RuntimeException) e.getCause();
                    throw e;
                }
            }
        } finally {
            pool.shutdown();
        }
        return results;
    }
}
