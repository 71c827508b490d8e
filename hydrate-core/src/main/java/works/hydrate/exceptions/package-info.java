/**
 * The exceptions thrown when raw data or declarations can't be mapped onto model classes.
 * All extend {@link works.hydrate.exceptions.ModelMappingException}.
 */
package works.hydrate.exceptions;
