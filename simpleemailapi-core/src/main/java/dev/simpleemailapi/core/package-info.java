/**
 * Protocol-level model shared by SimpleEmailAPI transports: service paths, the event model,
 * error codes and the structured error type.
 *
 * <p>This package has no third-party dependencies.
 */
package dev.simpleemailapi.core;
