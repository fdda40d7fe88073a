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

package com.gnssanomaly;

import com.gnssanomaly.tree.IsolationTree;

/**
 * A visitor computes a per-tree result for a query point. The forest
 * traversal executors apply a visitor to each tree and combine the results.
 *
 * @param <R> The type of the per-tree result.
 */
@FunctionalInterface
public interface Visitor<R> {

    /**
     * @param tree  a built tree
     * @param point the query point
     * @return the result of this tree for the point
     */
    R visit(IsolationTree tree, double[] point);
}
