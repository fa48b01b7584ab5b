// Copyright 2025 The Bazel Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package net.flowlint.java.syntax;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Syntax tree for a source file (a module): the root of every analyzed unit.
 *
 * <p>Parsing a file never fails outright; scanner and parser errors are recorded in {@link
 * #errors} and the tree covers whatever could be recovered.
 */
public final class SourceFile extends Node {

  private final ImmutableList<Statement> statements;
  private final FileOptions options;
  private final ImmutableList<SyntaxError> errors;
  private final int endOffset;

  private SourceFile(
      FileLocations locs,
      ImmutableList<Statement> statements,
      FileOptions options,
      ImmutableList<SyntaxError> errors,
      int endOffset) {
    super(locs);
    this.statements = statements;
    this.options = options;
    this.errors = errors;
    this.endOffset = endOffset;
  }

  // Creates a SourceFile from the given effective list of statements, and links parents.
  static SourceFile create(
      FileLocations locs,
      ImmutableList<Statement> statements,
      FileOptions options,
      List<SyntaxError> errors,
      int endOffset) {
    SourceFile file =
        new SourceFile(locs, statements, options, ImmutableList.copyOf(errors), endOffset);
    Nodes.linkParents(file);
    return file;
  }

  /**
   * Returns a synthetic file whose top-level statements are the given ones. The statements must be
   * freshly built, without a parent: they become children of the new file.
   */
  public static SourceFile wrap(List<? extends Statement> statements) {
    if (statements.isEmpty()) {
      throw new IllegalArgumentException("no statements to wrap");
    }
    Statement first = statements.get(0);
    return create(
        first.locs,
        ImmutableList.copyOf(statements),
        FileOptions.DEFAULT,
        ImmutableList.of(),
        statements.get(statements.size() - 1).getEndOffset());
  }

  /** Returns an unmodifiable view of the list of scanner, parser, and (perhaps) resolver errors. */
  public ImmutableList<SyntaxError> errors() {
    return errors;
  }

  /** Returns true if there were no errors during scanning and parsing. */
  public boolean ok() {
    return errors.isEmpty();
  }

  /** Returns the top-level statements of this file. */
  public ImmutableList<Statement> getStatements() {
    return statements;
  }

  /** Returns the options used when parsing this file. */
  public FileOptions getOptions() {
    return options;
  }

  /**
   * Parse the specified file, returning its syntax tree with its errors. This operation never
   * fails.
   */
  public static SourceFile parse(ParserInput input, FileOptions options) {
    return Parser.parseFile(input, options);
  }

  /** Parse a file with default options. */
  public static SourceFile parse(ParserInput input) {
    return parse(input, FileOptions.DEFAULT);
  }

  /**
   * Parse the specified file, throwing the first errors if it is not well formed.
   *
   * @throws SyntaxError.Exception if the file contains syntax errors.
   */
  public static SourceFile parseStrict(ParserInput input) throws SyntaxError.Exception {
    SourceFile file = parse(input);
    if (!file.ok()) {
      throw new SyntaxError.Exception(file.errors());
    }
    return file;
  }

  @Override
  public int getStartOffset() {
    return 0;
  }

  @Override
  public int getEndOffset() {
    return endOffset;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
