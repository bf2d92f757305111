/**
 * Runtime facade package.
 *
 * <p>{@link io.chatvault.runtime.ChatVault} is the object an application holds: it
 * bootstraps the data root, keeps the single verified connection and exposes account,
 * conversation, memory, attachment and audit operations.
 */
package io.chatvault.runtime;
