/// Splitting ordered sequences into contiguous runs at boundary elements.
///
/// A boundary predicate is tested against the elements of a source, in order. Each
/// matching element either opens the following run ([SplitMode#BEFORE]) or closes the
/// current run ([SplitMode#AFTER]). The runs cover the source exactly once, are never
/// empty, and are views over the source rather than copies.
///
/// ## Key Components
///
/// - {@link io.nosqlbench.runsplit.Runs}: Entry points for lists, arrays and byte buffers
/// - {@link io.nosqlbench.runsplit.RunSplitter}: Lazy, single-pass producer of run views
/// - {@link io.nosqlbench.runsplit.RunSplits}: Reusable iterable of runs over one source
/// - {@link io.nosqlbench.runsplit.RunCursor}: Position-level producer of run extents
///
/// ## Usage Example
///
/// ```java
/// for (List<String> section : Runs.beforeEach(lines, l -> l.startsWith("#"))) {
///   process(section);
/// }
/// ```
package io.nosqlbench.runsplit;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
