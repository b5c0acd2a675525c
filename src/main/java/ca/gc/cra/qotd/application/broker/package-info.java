/**
 * Single-owner access to the quote source.
 * <p>{@link ca.gc.cra.qotd.application.broker.QuoteBroker} runs one worker thread that alone reads the corpus;
 * every client handler asks it for quotes through a bounded FIFO queue.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.qotd.application.broker;
