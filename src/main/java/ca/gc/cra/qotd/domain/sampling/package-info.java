/**
 * Weighted random selection used to give every quote in the corpus the same chance of being served.
 *
 * @since 0.1.0
 */
package ca.gc.cra.qotd.domain.sampling;
