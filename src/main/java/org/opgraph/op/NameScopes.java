/* Copyright 2019 The TensorFlow Authors. All Rights Reserved.

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

    http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
==============================================================================*/

package org.opgraph.op;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.opgraph.IllegalNameException;

/**
 * Validation and rewriting of hierarchical operation names.
 *
 * <p>Names are made of components separated by a forward slash {@code '/'}, for instance {@code
 * nn/Const_72} or {@code nn/gradient/assign/init}. Each prefix of components is a name scope.
 */
public final class NameScopes {

  /**
   * Checks that {@code name} can name an operation.
   *
   * @throws IllegalNameException if it does not match {@code [A-Za-z0-9.][A-Za-z0-9_.\-/]*}
   */
  public static void checkOpName(String name) {
    if (name == null || !OP_NAME_REGEX.matcher(name).matches()) {
      throw new IllegalNameException(
          String.format(
              "invalid name: '%s' does not match the regular expression %s",
              name, OP_NAME_REGEX.pattern()));
    }
  }

  /**
   * Checks that {@code name} can be used as a single name component, as {@link
   * Scope#withName(String)} requires.
   *
   * @throws IllegalNameException if it does not match {@code [A-Za-z0-9.][A-Za-z0-9_.\-]*}
   */
  public static void checkComponentName(String name) {
    if (name == null || !COMPONENT_REGEX.matcher(name).matches()) {
      throw new IllegalNameException(
          String.format(
              "invalid name: '%s' does not match the regular expression %s",
              name, COMPONENT_REGEX.pattern()));
    }
  }

  /**
   * Checks a name scope entered from {@code parentScope}.
   *
   * <p>At the root, name scopes follow the rules of operation names so fully qualified names never
   * start with an underscore, a dash or a slash. Nested name scopes may start with any of these.
   * The empty name scope, which returns to the root, is always valid.
   *
   * @throws IllegalNameException if the name scope is invalid
   */
  public static void checkNameScope(String nameScope, String parentScope) {
    if (nameScope == null) {
      throw new IllegalNameException("Name scopes cannot be null");
    }
    if (nameScope.isEmpty()) {
      return;
    }
    Pattern pattern = parentScope.isEmpty() ? OP_NAME_REGEX : NAME_SCOPE_REGEX;
    if (!pattern.matcher(nameScope).matches()) {
      throw new IllegalNameException(
          String.format(
              "Illegal name scope '%s': it does not match the regular expression %s",
              nameScope, pattern.pattern()));
    }
  }

  /**
   * Removes the {@code nameScope} prefix from {@code name}.
   *
   * <p>Control input names ({@code ^name}) and colocation entries ({@code loc:@name}) keep their
   * marker. Names outside {@code nameScope} are returned unchanged.
   */
  public static String stripNameScope(String nameScope, String name) {
    if (nameScope.isEmpty()) {
      return name;
    }
    Matcher m =
        Pattern.compile("([\\^]|loc:@|^)" + Pattern.quote(nameScope) + "[/]+(.*)").matcher(name);
    return m.replaceFirst("$1$2");
  }

  /**
   * Adds the {@code nameScope} prefix to {@code name}, after any {@code ^} or {@code loc:@}
   * marker.
   */
  public static String prependNameScope(String nameScope, String name) {
    if (nameScope.isEmpty()) {
      return name;
    }
    String replacement = "$1" + Matcher.quoteReplacement(nameScope) + "/$2";
    return PREFIX_REGEX.matcher(name).replaceFirst(replacement);
  }

  // Node names must start with a letter, digit or dot, followed by letters, digits, dashes, dots,
  // slashes and underscores. The slash separates name scopes.
  private static final Pattern OP_NAME_REGEX = Pattern.compile("[A-Za-z0-9.][A-Za-z0-9_.\\-/]*");

  private static final Pattern NAME_SCOPE_REGEX = Pattern.compile("[A-Za-z0-9_.\\-/]*");

  private static final Pattern COMPONENT_REGEX = Pattern.compile("[A-Za-z0-9.][A-Za-z0-9_.\\-]*");

  private static final Pattern PREFIX_REGEX = Pattern.compile("([\\^]|loc:@|^)(.*)");

  private NameScopes() {}
}
