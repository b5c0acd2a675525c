/**
 * Executor factories for listener, broker and connection threads.
 * <p><strong>Concurrency:</strong> Provides thread-safe factory methods that return managed executors.</p>
 * <p><strong>Security:</strong> Thread names carry no client data.</p>
 */
package ca.gc.cra.qotd.infrastructure.exec;
