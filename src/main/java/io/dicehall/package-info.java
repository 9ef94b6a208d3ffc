/**
 * DiceHall source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.dicehall.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.dicehall.cli.DiceHallCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.dicehall.runtime.SessionCoordinator} claims sessions and applies turns.</li>
 *   <li>{@code io.dicehall.storage.SessionStore} is the authoritative persistence layer.</li>
 * </ul>
 */
package io.dicehall;
