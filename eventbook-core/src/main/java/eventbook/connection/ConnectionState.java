package eventbook.connection;

/**
 * Lifecycle of the handle cached by a {@link ConnectionManager}.
 *
 * <pre>
 * UNINITIALIZED ──acquire()──▶ CONNECTING ──success──▶ READY
 *       ▲                          │
 *       └──────────failure─────────┘
 * any ──close()──▶ CLOSED
 * </pre>
 */
public enum ConnectionState {
  /** No handle and no attempt in flight. The next {@code acquire()} starts one. */
  UNINITIALIZED,
  /** One attempt in flight; callers await it. */
  CONNECTING,
  /** Handle cached; returned to every caller. */
  READY,
  /** Torn down; {@code acquire()} fails. */
  CLOSED
}
