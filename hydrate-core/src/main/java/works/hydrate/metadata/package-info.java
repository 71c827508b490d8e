/**
 * Declarations describing how each field of a model class is reconstructed.
 * <p>
 * Declarations are recorded in a {@link works.hydrate.metadata.MetadataRegistry},
 * either directly or through {@link works.hydrate.metadata.ModelDeclaration},
 * and consulted by the {@link works.hydrate.Deserializer Deserializer}.
 */
package works.hydrate.metadata;
