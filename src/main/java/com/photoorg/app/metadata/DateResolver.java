package com.photoorg.app.metadata;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Resolve a data de captura de um arquivo.
 * Nunca lança exceção: data ausente ou metadado corrompido resulta em {@code Optional.empty()}.
 */
@FunctionalInterface
public interface DateResolver {

    Optional<CaptureDate> resolve(Path file);
}
