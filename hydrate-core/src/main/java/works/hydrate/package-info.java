/**
 * Reconstructs model objects from loosely-typed records.
 * <p>
 * Declare how each field is rebuilt in a {@link works.hydrate.metadata.MetadataRegistry},
 * either with explicit calls or with the {@link works.hydrate.annotations annotations}
 * and a {@link works.hydrate.ModelScanner}; then build a {@link works.hydrate.Deserializer}
 * over the registry and hand it raw records.
 * Failures are reported with the exceptions in {@link works.hydrate.exceptions}.
 */
package works.hydrate;
