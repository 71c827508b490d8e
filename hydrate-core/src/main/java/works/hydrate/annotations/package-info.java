/**
 * Field annotations read by {@link works.hydrate.ModelScanner}.
 */
package works.hydrate.annotations;
