/**
 * Network adapters for the Quote of the Day protocol (RFC 865).
 * <p><strong>Role:</strong> {@link ca.gc.cra.qotd.infrastructure.net.QuoteServer} answers TCP and UDP clients through
 * the broker; {@link ca.gc.cra.qotd.infrastructure.net.QuoteClient} fetches a single quote.</p>
 * <p><strong>Concurrency:</strong> One accept thread, one receive thread and a cached pool of connection tasks.</p>
 * <p><strong>Metrics:</strong> {@code qotd.tcp.*} and {@code qotd.udp.*} counters.</p>
 * <p><strong>Security:</strong> Client input is never interpreted; no authentication or encryption.</p>
 */
package ca.gc.cra.qotd.infrastructure.net;
