/**
 * Public API of the brouwer parser.
 *
 * <p><b>Outcomes</b>
 *
 * <ul>
 *   <li>A {@code Root} {@link io.brouwer.parser.ast.Node} when the source holds a program.
 *   <li>{@link io.brouwer.parser.api.BrouwerSyntaxException} for the first syntax error, with the
 *       reason and a 1-based {@link io.brouwer.parser.api.TextPosition}. There is no recovery.
 *   <li>{@link io.brouwer.parser.api.EmptyProgramException} when there is no module declaration.
 * </ul>
 *
 * <p><b>Example</b>
 *
 * <pre>{@code
 * BrouwerParser parser = BrouwerParser.create(ParserOptions.defaults().withMaxDepth(512));
 * Node root = parser.parse(Path.of("Main.br"));
 * }</pre>
 */
package io.brouwer.parser.api;
