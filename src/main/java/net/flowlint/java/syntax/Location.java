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

import com.google.common.base.Preconditions;
import java.util.Objects;
import javax.annotation.concurrent.Immutable;

/**
 * A Location denotes a position within a source file, as a file name, a line number, and a column
 * number. Lines and columns are 1-based; zero means unknown.
 */
@Immutable
public final class Location implements Comparable<Location> {

  private final String file;
  private final int line;
  private final int column;

  public Location(String file, int line, int column) {
    this.file = Preconditions.checkNotNull(file);
    this.line = line;
    this.column = column;
  }

  /** Returns the name of the file containing this location. */
  public String file() {
    return file;
  }

  /** Returns the line number of this location. */
  public int line() {
    return line;
  }

  /** Returns the column number of this location. */
  public int column() {
    return column;
  }

  /** Returns a Location for the given file, but no specific line or column. */
  public static Location fromFile(String file) {
    return new Location(file, 0, 0);
  }

  /** Returns the location in the format "filename:line:column". */
  @Override
  public String toString() {
    StringBuilder buf = new StringBuilder();
    buf.append(file);
    if (line != 0) {
      buf.append(':').append(line);
      if (column != 0) {
        buf.append(':').append(column);
      }
    }
    return buf.toString();
  }

  @Override
  public int compareTo(Location that) {
    int cmp = this.file.compareTo(that.file);
    if (cmp != 0) {
      return cmp;
    }
    return Long.compare(
        ((long) this.line << 32) | this.column, ((long) that.line << 32) | that.column);
  }

  @Override
  public int hashCode() {
    return Objects.hash(file, line, column);
  }

  @Override
  public boolean equals(Object that) {
    return this == that
        || (that instanceof Location
            && this.file.equals(((Location) that).file)
            && this.line == ((Location) that).line
            && this.column == ((Location) that).column);
  }
}
