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
import java.util.Arrays;

/**
 * FileLocations maps each source offset within a file to a Location. An offset is a (UTF-16) char
 * index such that {@code 0 <= offset <= size}. A Location is a (file, line, column) triple.
 */
final class FileLocations {

  private final int[] linestart; // maps line number (line >= 1) to char offset
  private final String file;
  private final char[] buffer;

  private FileLocations(int[] linestart, String file, char[] buffer) {
    this.linestart = linestart;
    this.file = file;
    this.buffer = buffer;
  }

  static FileLocations create(char[] buffer, String file) {
    return new FileLocations(computeLinestart(buffer), file, buffer);
  }

  String file() {
    return file;
  }

  private int getLineAt(int offset) {
    Preconditions.checkArgument(
        0 <= offset && offset <= buffer.length, "offset out of range (%s)", offset);
    int index = Arrays.binarySearch(linestart, 1, linestart.length, offset);
    if (index >= 0) {
      return index;
    }
    return -2 - index; // (insertion point) - 1
  }

  Location getLocation(int offset) {
    int line = getLineAt(offset);
    int column = offset - linestart[line] + 1;
    return new Location(file, line, column);
  }

  /** Returns the source text between two offsets, clamped to the buffer. */
  String slice(int start, int end) {
    start = Math.max(0, Math.min(start, buffer.length));
    end = Math.max(start, Math.min(end, buffer.length));
    return new String(buffer, start, end - start);
  }

  private static int[] computeLinestart(char[] buffer) {
    // Compute the size.
    int size = 2;
    for (int i = 0; i < buffer.length; i++) {
      if (buffer[i] == '\n') {
        size++;
      }
    }
    int[] linestart = new int[size];

    // Fill in the table.
    int index = 0;
    linestart[index++] = 0; // sentinel for line 0, so that real lines are 1-based
    linestart[index++] = 0;
    for (int i = 0; i < buffer.length; i++) {
      if (buffer[i] == '\n') {
        linestart[index++] = i + 1;
      }
    }
    return linestart;
  }
}
