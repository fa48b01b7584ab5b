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

/** A call of a function through a name. */
public final class CallSite {

  private final CallExpression call;
  private final VarEvent callee;
  private final Scope caller;

  CallSite(CallExpression call, VarEvent callee, Scope caller) {
    this.call = call;
    this.callee = callee;
    this.caller = caller;
  }

  public CallExpression getCall() {
    return call;
  }

  /** Returns the read of the name through which the function is called. */
  public VarEvent getCallee() {
    return callee;
  }

  /** Returns the scope in which the call occurs. */
  public Scope getCaller() {
    return caller;
  }

  @Override
  public String toString() {
    return "call of " + callee.getVariable() + " in " + caller.getName();
  }
}
