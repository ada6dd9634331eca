/**
 * Persistence and caching for channel policies and user offense counters.
 * SQLite-backed in production, in-memory in TEST mode.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 *   [Command handlers]
 *        │
 *        ▼
 *   RulesRepository    ← read-through cache, single public entry point
 *        │               (three MemoizingCaches, evicted on write)
 *        ▼
 *   DatabaseService    ← interface (PROD ↔ TEST swap via RulesModule)
 *    ┌───┴───┐
 *    │       │
 *  SqlDB   TestDB
 * </pre>
 *
 * <h2>Database Schema</h2>
 *
 * <pre>
 * ┌───────────────────────────────────────────────────────────────────┐
 * │ channel_configs (one row per channel)                            │
 * ├──────────────────┬────────────────────────────────────────────────┤
 * │ guild_id   (PK)  │ Guild snowflake                               │
 * │ channel_id (PK)  │ Channel snowflake                             │
 * │ event_expectancy │ 0.0–1.0 chance of an event per cooldown       │
 * │ event_duration   │ Hours                                         │
 * │ event_cooldown   │ Hours                                         │
 * │ last_event       │ Epoch seconds                                 │
 * │ max_offenses     │ Offenses before a timeout                     │
 * │ timeout_duration │ Seconds                                       │
 * │ prefixes         │ Space/comma separated tokens                  │
 * └──────────────────┴────────────────────────────────────────────────┘
 *
 * ┌───────────────────────────────────────────────────────────────────┐
 * │ user_offenses (one row per user per channel)                     │
 * ├──────────────────┬────────────────────────────────────────────────┤
 * │ guild_id   (PK)  │ Guild snowflake                               │
 * │ channel_id (PK)  │ Channel snowflake                             │
 * │ user_id    (PK)  │ User snowflake                                │
 * │ current_offenses │ Since last reset                              │
 * │ total_offenses   │ Lifetime, never decreases                     │
 * │ last_offense     │ Epoch seconds                                 │
 * └──────────────────┴────────────────────────────────────────────────┘
 * </pre>
 *
 * Rows are never patched. An upsert deletes the row for its key and inserts
 * the new one inside a single transaction.
 *
 * <h2>SQL File Inventory</h2>
 * All SQL statements are externalized to {@code sql/*.sql}, loaded via
 * {@link de.bsommerfeld.pseat.db.SqlLoader}:
 * <ul>
 * <li>{@code select-config.sql}, {@code delete-config.sql},
 * {@code insert-config.sql}</li>
 * <li>{@code select-user.sql}, {@code delete-user.sql},
 * {@code insert-user.sql}</li>
 * <li>{@code select-users-for-channel.sql}: all users of one channel</li>
 * <li>{@code count-configs.sql}, {@code count-users.sql}: startup
 * diagnostics</li>
 * </ul>
 */
package de.bsommerfeld.pseat.db;
