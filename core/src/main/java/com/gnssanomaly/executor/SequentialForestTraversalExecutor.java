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

import java.util.List;
import java.util.function.BinaryOperator;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.stream.Collector;

import com.gnssanomaly.Visitor;
import com.gnssanomaly.tree.IsolationTree;

/**
 * Traverses the trees one after the other on the calling thread.
 */
public class SequentialForestTraversalExecutor extends AbstractForestTraversalExecutor {

    public SequentialForestTraversalExecutor(List<IsolationTree> trees) {
        super(trees);
    }

    @Override
    public <R, S> S traverseForest(double[] point, Visitor<R> visitor, BinaryOperator<R> accumulator,
            Function<R, S> finisher) {

        R unnormalizedResult = trees.stream().map(t -> visitor.visit(t, point)).reduce(accumulator)
                .orElseThrow(() -> new IllegalStateException("accumulator returned an empty result"));

        return finisher.apply(unnormalizedResult);
    }

    @Override
    public <R, S> S traverseForest(double[] point, Visitor<R> visitor, Collector<R, ?, S> collector) {
        return trees.stream().map(t -> visitor.visit(t, point)).collect(collector);
    }

    @Override
    public void forEachTree(Consumer<IsolationTree> action) {
        trees.forEach(action);
    }
}
