package com.flamingo.ai.graphrag.graph;

import com.flamingo.ai.graphrag.exception.InvalidInputException;
import java.util.regex.Pattern;

/** Namespaces become Cypher labels, so only plain identifiers are accepted. */
public final class NamespaceValidator {

  private static final Pattern LABEL = Pattern.compile("[A-Za-z_][A-Za-z0-9_]{0,63}");

  private NamespaceValidator() {}

  public static boolean isValid(String namespace) {
    return namespace != null && LABEL.matcher(namespace).matches();
  }

  /** Returns the namespace unchanged or throws {@link InvalidInputException}. */
  public static String requireValid(String namespace) {
    if (!isValid(namespace)) {
      throw new InvalidInputException(
          "namespace", "must be an identifier ([A-Za-z_][A-Za-z0-9_]*), got '" + namespace + "'");
    }
    return namespace;
  }
}
