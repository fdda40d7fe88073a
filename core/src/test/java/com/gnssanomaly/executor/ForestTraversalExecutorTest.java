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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.AdditionalMatchers.aryEq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.ArgumentsProvider;
import org.junit.jupiter.params.provider.ArgumentsSource;

import com.gnssanomaly.tree.IsolationTree;

public class ForestTraversalExecutorTest {

    private static final double EPSILON = 1e-10;

    private static int numberOfTrees = 10;
    private static int threadPoolSize = 2;

    private static class TestExecutorProvider implements ArgumentsProvider {
        @Override
        public Stream<? extends Arguments> provideArguments(ExtensionContext context) throws Exception {

            List<IsolationTree> sequentialTrees = new ArrayList<>();
            List<IsolationTree> parallelTrees = new ArrayList<>();

            for (int i = 0; i < numberOfTrees; i++) {
                sequentialTrees.add(mock(IsolationTree.class));
                parallelTrees.add(mock(IsolationTree.class));
            }

            SequentialForestTraversalExecutor sequentialExecutor = new SequentialForestTraversalExecutor(
                    sequentialTrees);

            ParallelForestTraversalExecutor parallelExecutor = new ParallelForestTraversalExecutor(parallelTrees,
                    threadPoolSize);

            return Stream.of(sequentialExecutor, parallelExecutor).map(Arguments::of);
        }
    }

    @ParameterizedTest
    @ArgumentsSource(TestExecutorProvider.class)
    public void testTraverseForestBinaryAccumulator(AbstractForestTraversalExecutor executor) {
        double[] point = new double[] { 1.2, -3.4 };
        double expectedResult = 0.0;
        Random random = new Random(11);

        for (int i = 0; i < numberOfTrees; i++) {
            double treeResult = random.nextDouble();
            when(executor.trees.get(i).pathLength(aryEq(point))).thenReturn(treeResult);
            expectedResult += treeResult;
        }

        expectedResult /= numberOfTrees;

        double result = executor.traverseForest(point, IsolationTree::pathLength, Double::sum,
                x -> x / numberOfTrees);

        for (IsolationTree tree : executor.trees) {
            verify(tree, times(1)).pathLength(aryEq(point));
        }

        assertEquals(expectedResult, result, EPSILON);
    }

    @ParameterizedTest
    @ArgumentsSource(TestExecutorProvider.class)
    public void testTraverseForestCollector(AbstractForestTraversalExecutor executor) {
        double[] point = new double[] { 1.2, -3.4 };
        double[] expectedResult = new double[numberOfTrees];
        Random random = new Random(12);

        for (int i = 0; i < numberOfTrees; i++) {
            double treeResult = random.nextDouble();
            when(executor.trees.get(i).pathLength(aryEq(point))).thenReturn(treeResult);
            expectedResult[i] = treeResult;
        }

        Arrays.sort(expectedResult);

        List<Double> result = executor.traverseForest(point, IsolationTree::pathLength,
                Collectors.collectingAndThen(Collectors.toList(), list -> {
                    List<Double> sorted = new ArrayList<>(list);
                    Collections.sort(sorted);
                    return sorted;
                }));

        for (IsolationTree tree : executor.trees) {
            verify(tree, times(1)).pathLength(aryEq(point));
        }

        assertEquals(numberOfTrees, result.size());
        for (int i = 0; i < numberOfTrees; i++) {
            assertEquals(expectedResult[i], result.get(i), EPSILON);
        }
    }

    @ParameterizedTest
    @ArgumentsSource(TestExecutorProvider.class)
    public void testForEachTree(AbstractForestTraversalExecutor executor) {
        AtomicInteger visited = new AtomicInteger();
        executor.forEachTree(tree -> {
            tree.isBuilt();
            visited.incrementAndGet();
        });

        assertEquals(numberOfTrees, visited.get());
        assertEquals(numberOfTrees, executor.size());
        for (IsolationTree tree : executor.trees) {
            verify(tree, times(1)).isBuilt();
        }
    }

    @ParameterizedTest
    @ArgumentsSource(TestExecutorProvider.class)
    public void testTraverseEmptyForest(AbstractForestTraversalExecutor executor) {
        AbstractForestTraversalExecutor empty = (executor instanceof ParallelForestTraversalExecutor)
                ? new ParallelForestTraversalExecutor(new ArrayList<>(), threadPoolSize)
                : new SequentialForestTraversalExecutor(new ArrayList<>());

        assertThrows(IllegalStateException.class,
                () -> empty.traverseForest(new double[] { 0.0 }, IsolationTree::pathLength, Double::sum, x -> x));
    }

    @Test
    public void testCloseShutsDownThreadPool() {
        List<IsolationTree> trees = new ArrayList<>();
        for (int i = 0; i < numberOfTrees; i++) {
            trees.add(mock(IsolationTree.class));
        }
        ParallelForestTraversalExecutor executor = new ParallelForestTraversalExecutor(trees, threadPoolSize);
        AtomicInteger visited = new AtomicInteger();
        executor.forEachTree(tree -> visited.incrementAndGet());
        ForkJoinPool pool = executor.getForkJoinPool();

        executor.close();

        assertEquals(numberOfTrees, visited.get());
        assertTrue(pool.isShutdown());
        executor.close();

        executor.forEachTree(tree -> visited.incrementAndGet());
        assertEquals(2 * numberOfTrees, visited.get());
        assertNotSame(pool, executor.getForkJoinPool());
        executor.close();
    }

    @Test
    public void testParallelExecutorRequiresThreads() {
        assertThrows(IllegalArgumentException.class,
                () -> new ParallelForestTraversalExecutor(new ArrayList<>(), 0));
    }
}
