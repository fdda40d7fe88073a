/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.gnssanomaly.executor;

import static com.gnssanomaly.CommonUtils.checkArgument;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ForkJoinPool;
import java.util.function.BinaryOperator;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.stream.Collector;

import com.gnssanomaly.Visitor;
import com.gnssanomaly.tree.IsolationTree;

/**
 * Traverses the trees with a parallel stream running inside a dedicated
 * {@link ForkJoinPool}, so that the forest never competes for the common pool.
 * Reductions happen in encounter order, so results do not depend on thread
 * scheduling.
 */
public class ParallelForestTraversalExecutor extends AbstractForestTraversalExecutor {

    private ForkJoinPool forkJoinPool;
    private final int threadPoolSize;

    public ParallelForestTraversalExecutor(List<IsolationTree> trees, int threadPoolSize) {
        super(trees);
        checkArgument(threadPoolSize > 0, "threadPoolSize must be greater than 0");
        this.threadPoolSize = threadPoolSize;
    }

    @Override
    public <R, S> S traverseForest(double[] point, Visitor<R> visitor, BinaryOperator<R> accumulator,
            Function<R, S> finisher) {

        return submitAndJoin(
                () -> trees.parallelStream().map(t -> visitor.visit(t, point)).reduce(accumulator).map(finisher))
                        .orElseThrow(() -> new IllegalStateException("accumulator returned an empty result"));
    }

    @Override
    public <R, S> S traverseForest(double[] point, Visitor<R> visitor, Collector<R, ?, S> collector) {
        return submitAndJoin(() -> trees.parallelStream().map(t -> visitor.visit(t, point)).collect(collector));
    }

    @Override
    public void forEachTree(Consumer<IsolationTree> action) {
        submitAndJoin(() -> {
            trees.parallelStream().forEach(action);
            return null;
        });
    }

    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    /**
     * Shuts the pool down. A later traversal starts a fresh pool.
     */
    @Override
    public synchronized void close() {
        if (forkJoinPool != null) {
            forkJoinPool.shutdown();
            forkJoinPool = null;
        }
    }

    private <T> T submitAndJoin(Callable<T> callable) {
        return getForkJoinPool().submit(callable).join();
    }

    synchronized ForkJoinPool getForkJoinPool() {
        if (forkJoinPool == null) {
            forkJoinPool = new ForkJoinPool(threadPoolSize);
        }
        return forkJoinPool;
    }
}
