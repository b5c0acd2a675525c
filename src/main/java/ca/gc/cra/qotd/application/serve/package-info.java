/**
 * Serving workflow: index the corpus, bind the listeners, answer clients.
 *
 * @since 0.1.0
 */
package ca.gc.cra.qotd.application.serve;
