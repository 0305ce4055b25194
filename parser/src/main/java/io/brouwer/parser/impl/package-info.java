/**
 * Grammar internals: the backtracking {@link io.brouwer.parser.impl.Cursor}, the layout rule in
 * {@link io.brouwer.parser.impl.IndentationEngine} and the productions in {@link
 * io.brouwer.parser.impl.Grammar}. Not meant for direct use.
 */
package io.brouwer.parser.impl;
