/**
 * ChatVault source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.chatvault.Main} starts the CLI process.</li>
 *   <li>{@code io.chatvault.cli.ChatVaultCommand} maps commands to the runtime facade.</li>
 *   <li>{@code io.chatvault.runtime.ChatVault} bootstraps a data root and owns the open database.</li>
 *   <li>{@code io.chatvault.storage.ConnectionOpener} detects and verifies an existing database file.</li>
 * </ul>
 */
package io.chatvault;
