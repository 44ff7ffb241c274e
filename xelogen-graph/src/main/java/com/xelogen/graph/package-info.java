/**
 * Typed node graph for the Xelogen visual scripting language.
 *
 * <ul>
 *   <li>{@link com.xelogen.graph.Datatype} – port types and the list/element relation</li>
 *   <li>{@link com.xelogen.graph.NodeSpec}, {@link com.xelogen.graph.NodeSpecRegistry} – node schemas</li>
 *   <li>{@link com.xelogen.graph.Graph}, {@link com.xelogen.graph.Node} – construction session and vertices;
 *       {@link com.xelogen.graph.InputPort#connect connect}, {@link com.xelogen.graph.InputPort#append append},
 *       {@link com.xelogen.graph.InputPort#bindToFirstMatchingOutput bindToFirstMatchingOutput}</li>
 *   <li>{@link com.xelogen.graph.flow} – impulse chains and If/Else branch scopes</li>
 *   <li>{@link com.xelogen.graph.combine} – operand kinds and the combinators behind {@code combine}</li>
 *   <li>{@link com.xelogen.graph.value} – typed value helpers</li>
 * </ul>
 * All construction errors are {@link com.xelogen.graph.GraphBuildException}s carrying an
 * {@link com.xelogen.graph.ErrorCode}.
 */
package com.xelogen.graph;
