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

package net.flowlint.java.analysis;

import net.flowlint.java.syntax.CallExpression;
import net.flowlint.java.syntax.Location;

/**
 * Thrown when a unit calls a builtin such as {@code locals()} that exposes its variables by name,
 * so that no static account of its variables can be complete.
 */
public final class UnknowableLocalsException extends Exception {

  private final Location location;

  UnknowableLocalsException(CallExpression call, String name) {
    super(
        String.format(
            "%s: call of %s() makes local variables unknowable", call.getLocation(), name));
    this.location = call.getLocation();
  }

  /** Returns the location of the offending call. */
  public Location getCallLocation() {
    return location;
  }
}
