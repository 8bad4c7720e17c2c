/**
 * SQLite storage engine for a per-user tree of directories, files and
 * checkpoints.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 *   [ContentsManager / ContentsAdmin]
 *        │  one transaction per operation
 *        ▼
 *   SqlDatabase        ← connection + transaction handling, schema
 *        │
 *        ▼
 *   UserStore · DirectoryStore · FileStore · CheckpointStore
 *        │                        (stateless, take a Connection)
 *        ▼
 *   ReencryptionService · ContentExporter   ← cross-user batch jobs
 * </pre>
 *
 * <h2>Database Schema</h2>
 * Every table is partitioned by {@code user_id}. Timestamps are epoch
 * milliseconds.
 *
 * <pre>
 * ┌───────────────────────────────────────────────────────────────────┐
 * │ users                                                             │
 * ├──────────────────┬────────────────────────────────────────────────┤
 * │ id  (PK)         │ User id, at most 30 characters                 │
 * └──────────────────┴────────────────────────────────────────────────┘
 *
 * ┌───────────────────────────────────────────────────────────────────┐
 * │ directories                                                       │
 * ├──────────────────┬────────────────────────────────────────────────┤
 * │ user_id (PK)     │ FK → users.id                                  │
 * │ name (PK)        │ '/a/b/': leading and trailing slash, root '/'  │
 * │ parent_user_id   │ = user_id, NULL only for the root              │
 * │ parent_name      │ Direct parent, NULL only for the root          │
 * └──────────────────┴────────────────────────────────────────────────┘
 *   (parent_user_id, parent_name) → directories(user_id, name), immediate.
 *   CHECKs: parent_name is a prefix of name with exactly one slash less.
 *
 * ┌───────────────────────────────────────────────────────────────────┐
 * │ files                                                             │
 * ├──────────────────┬────────────────────────────────────────────────┤
 * │ id  (PK, auto)   │ Stable across renames                          │
 * │ user_id          │ FK → users.id                                  │
 * │ parent_name      │ FK → directories, ON UPDATE CASCADE            │
 * │ name             │ Leaf name                                      │
 * │ content          │ Encrypted bytes                                │
 * │ created_at       │ Last save or rename                            │
 * └──────────────────┴────────────────────────────────────────────────┘
 *   UNIQUE (user_id, parent_name, name): one current row per path.
 *
 * ┌───────────────────────────────────────────────────────────────────┐
 * │ remote_checkpoints                                                │
 * ├──────────────────┬────────────────────────────────────────────────┤
 * │ id  (PK, auto)   │ Checkpoint id                                  │
 * │ user_id          │ FK → users.id                                  │
 * │ path             │ '/a/b.txt', not foreign-keyed                  │
 * │ content          │ Encrypted bytes                                │
 * │ last_modified    │ Creation time                                  │
 * └──────────────────┴────────────────────────────────────────────────┘
 * </pre>
 *
 * <h2>Concurrency</h2>
 * Two writers saving the same new path both insert; the loser hits the
 * unique constraint, rolls back to its savepoint and updates instead.
 * Deleting a directory that still has children fails at the offending
 * statement because the self reference is immediate, and surfaces as
 * {@code DirectoryNotEmptyException}.
 * The file runs in WAL mode: writers queue on one lock, readers in
 * {@code SqlDatabase#inReadTransaction} see the last commit and never wait.
 *
 * <h2>SQL File Inventory</h2>
 * All statements are externalized to {@code sql/*.sql}, loaded via
 * {@link SqlLoader}. Names follow {@code <operation>-<entity>.sql}; the
 * two subtree rewrites ({@code rename-descendant-directories.sql},
 * {@code move-checkpoints-under.sql}) use numbered parameters.
 */
package de.bsommerfeld.sqlcontents.db;
