/**
 * Feeds JSON into the deserializer using Jackson.
 */
package works.hydrate.jackson;
