package io.brouwer.parser.ast;

import java.util.Locale;

/** Grammar symbol of an AST {@link Node}. */
public enum NodeKind {
  // Structure
  ROOT,
  PROG,
  MOD_DECL,
  IMPORT,
  LINE,
  EXPR,

  // Statement and expression forms
  VAR,
  ASSIGN,
  FN_DECL,
  PARENED,
  RETURN,
  CASE,
  CASE_BRANCH,
  IF_ELSE,
  TRY,
  WHILE,
  FOR,
  LAMBDA,
  PARAM,
  TUPLE_LIT,
  LIST_LIT,
  LIST_COMP,
  DICT_LIT,
  DICT_COMP,
  DICT_ENTRY,
  SET_LIT,
  SET_COMP,
  GENERATOR,
  INFIXED,
  OP,

  // Identifiers
  QUAL_IDENT,
  NAMESPACED_IDENT,
  IDENT,
  MEMBER_IDENT,
  SCOPED_IDENT,
  TYPE_IDENT,

  // Patterns
  PATTERN,

  // Literals
  NUM_LIT,
  INT_LIT,
  REAL_LIT,
  ABS_INT,
  ABS_REAL,
  CHR_LIT,
  CHR_CHR,
  STR_LIT,
  STR_CHR,

  // Keywords
  MODULE_KEYWORD,
  EXPOSING_KEYWORD,
  HIDING_KEYWORD,
  IMPORT_KEYWORD,
  AS_KEYWORD,
  FN_KEYWORD,
  CASE_KEYWORD,
  IF_KEYWORD,
  ELSE_KEYWORD,
  TRY_KEYWORD,
  CATCH_KEYWORD,
  WHILE_KEYWORD,
  FOR_KEYWORD,
  IN_KEYWORD,
  VAR_KEYWORD,
  NAN_KEYWORD,
  INFINITY_KEYWORD,
  RETURN_KEYWORD,

  // Punctuation
  EQUALS,
  SINGLE_QUOTE,
  DOUBLE_QUOTE,
  DOT,
  COMMA,
  COLON,
  DOUBLE_COLON,
  UNDERSCORE,
  L_ARROW,
  R_ARROW,
  FAT_R_ARROW,
  L_PAREN,
  R_PAREN,
  L_SQ_BRACKET,
  R_SQ_BRACKET,
  L_CURLY_BRACKET,
  R_CURLY_BRACKET,
  BACKSLASH,
  MINUS,
  BAR,
  BACKTICK;

  private final String displayName;

  NodeKind() {
    StringBuilder sb = new StringBuilder();
    for (String part : name().split("_")) {
      sb.append(part.charAt(0)).append(part.substring(1).toLowerCase(Locale.ROOT));
    }
    this.displayName = sb.toString();
  }

  /** CamelCase name used in AST dumps, e.g. {@code ModDecl} or {@code LSqBracket}. */
  public String displayName() {
    return displayName;
  }
}
