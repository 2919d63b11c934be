package org.surrealkit.testkit;

public record HeaderAssertionSpec(String name, Boolean exists, String equalTo, String contains, String regex) {}
