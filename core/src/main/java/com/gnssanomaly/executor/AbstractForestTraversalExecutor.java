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

import static com.gnssanomaly.CommonUtils.checkNotNull;

import java.io.Closeable;
import java.util.List;
import java.util.function.BinaryOperator;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.stream.Collector;

import com.gnssanomaly.Visitor;
import com.gnssanomaly.tree.IsolationTree;

public abstract class AbstractForestTraversalExecutor implements Closeable {

    protected final List<IsolationTree> trees;

    protected AbstractForestTraversalExecutor(List<IsolationTree> trees) {
        this.trees = checkNotNull(trees, "trees must not be null");
    }

    /**
     * Visit each of the trees in the forest and combine the individual results into
     * an aggregate result. The results from all the trees are combined using the
     * accumulator and then transformed using the finisher before being returned.
     *
     * @param point       The point that defines the traversal path.
     * @param visitor     The per-tree computation.
     * @param accumulator A function that combines the results from individual
     *                    trees into an aggregate result.
     * @param finisher    A function called on the aggregate result in order to
     *                    produce the final result.
     * @param <R>         The visitor result type. This is the type that will be
     *                    returned after traversing each individual tree.
     * @param <S>         The final type, after any final normalization at the
     *                    forest level.
     * @return The aggregated and finalized result after sending a visitor through
     *         each tree in the forest.
     */
    public abstract <R, S> S traverseForest(double[] point, Visitor<R> visitor, BinaryOperator<R> accumulator,
            Function<R, S> finisher);

    /**
     * Visit each of the trees in the forest and collect the individual results
     * using the {@link java.util.stream.Collector}.
     *
     * @param point     The point that defines the traversal path.
     * @param visitor   The per-tree computation.
     * @param collector A collector used to aggregate individual tree results into
     *                  a final result.
     * @param <R>       The visitor result type.
     * @param <S>       The final type.
     * @return The collected result.
     */
    public abstract <R, S> S traverseForest(double[] point, Visitor<R> visitor, Collector<R, ?, S> collector);

    /**
     * Apply an action to every tree, for example building it. Actions on
     * different trees must not share mutable state.
     *
     * @param action the action to apply
     */
    public abstract void forEachTree(Consumer<IsolationTree> action);

    public int size() {
        return trees.size();
    }

    /**
     * Releases any threads held by this executor. The default does nothing.
     */
    @Override
    public void close() {
    }
}
