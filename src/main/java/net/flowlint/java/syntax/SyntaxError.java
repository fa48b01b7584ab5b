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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * A SyntaxError represents a static error associated with the syntax, such as a scanner or parse
 * error.
 */
public final class SyntaxError {

  private final Location location;
  private final String message;

  public SyntaxError(Location location, String message) {
    this.location = location;
    this.message = message;
  }

  /** Returns the location of the error. */
  public Location location() {
    return location;
  }

  /** Returns a description of the error. */
  public String message() {
    return message;
  }

  /** Returns a string of the form {@code "foo.py:1:2: oops"}. */
  @Override
  public String toString() {
    return location + ": " + message;
  }

  /**
   * Returns a single string that is the concatenation of the messages of the specified errors, each
   * prefixed by its location.
   */
  public static String toString(List<SyntaxError> errors) {
    return Joiner.on("\n").join(errors);
  }

  /** A SyntaxError.Exception is an exception holding one or more syntax errors. */
  public static final class Exception extends java.lang.Exception {

    private final ImmutableList<SyntaxError> errors;

    /** Constructs a SyntaxError.Exception from a non-empty list of errors. */
    public Exception(List<SyntaxError> errors) {
      if (errors.isEmpty()) {
        throw new IllegalArgumentException("no errors");
      }
      this.errors = ImmutableList.copyOf(errors);
    }

    /** Returns an immutable non-empty list of errors. */
    public ImmutableList<SyntaxError> errors() {
      return errors;
    }

    @Override
    public String getMessage() {
      return errors.get(0).toString() + (errors.size() > 1 ? " (and more errors)" : "");
    }
  }
}
