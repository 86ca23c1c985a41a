package com.photoorg.app.pipeline;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Checagens de origem/destino antes da execução. Só lê o sistema de arquivos.
 */
public final class PathSafety {

    private PathSafety() {}

    /**
     * @return origem e destino como caminhos reais (o destino pode ainda não existir)
     */
    public static Resolved validate(Path source, Path destination) throws PreRunValidationException {
        if (source == null) throw new PreRunValidationException("Origem não informada");
        if (destination == null) throw new PreRunValidationException("Destino não informado");

        Path src = source.toAbsolutePath().normalize();
        if (!Files.exists(src)) {
            throw new PreRunValidationException("Origem não existe: " + src);
        }
        if (!Files.isDirectory(src)) {
            throw new PreRunValidationException("Origem não é um diretório: " + src);
        }
        if (!Files.isReadable(src)) {
            throw new PreRunValidationException("Origem sem permissão de leitura: " + src);
        }

        Path dst = destination.toAbsolutePath().normalize();
        if (Files.exists(dst)) {
            if (!Files.isDirectory(dst)) {
                throw new PreRunValidationException("Destino existe e não é um diretório: " + dst);
            }
            if (!Files.isWritable(dst)) {
                throw new PreRunValidationException("Destino sem permissão de escrita: " + dst);
            }
        } else {
            Path ancestor = existingAncestor(dst);
            if (ancestor == null || !Files.isDirectory(ancestor) || !Files.isWritable(ancestor)) {
                throw new PreRunValidationException("Destino não pode ser criado: " + dst);
            }
        }

        Path realSrc;
        Path realDst;
        try {
            realSrc = src.toRealPath();
            realDst = realPathAllowMissing(dst);
        } catch (IOException e) {
            throw new PreRunValidationException("Não foi possível resolver os caminhos: " + e.getMessage(), e);
        }

        if (realSrc.equals(realDst)) {
            throw new PreRunValidationException("Origem e destino são o mesmo diretório: " + realSrc);
        }
        if (realDst.startsWith(realSrc)) {
            throw new PreRunValidationException("Destino está dentro da origem: " + realDst + " em " + realSrc);
        }
        if (realSrc.startsWith(realDst)) {
            throw new PreRunValidationException("Origem está dentro do destino: " + realSrc + " em " + realDst);
        }
        return new Resolved(realSrc, realDst);
    }

    public record Resolved(Path source, Path destination) {}

    private static Path existingAncestor(Path p) {
        Path cur = p;
        while (cur != null && !Files.exists(cur)) {
            cur = cur.getParent();
        }
        return cur;
    }

    /** Resolve links do maior prefixo existente e reanexa o restante. */
    private static Path realPathAllowMissing(Path p) throws IOException {
        Path ancestor = existingAncestor(p);
        if (ancestor == null) return p;
        Path rest = ancestor.relativize(p);
        return ancestor.toRealPath().resolve(rest).normalize();
    }
}
