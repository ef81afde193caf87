package org.scout.core.prep;

public record PrepRegistration(PrepScope scope, String name, PrepFactory factory) {
}
