package com.photoorg.app.report;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import com.photoorg.app.index.DuplicateIndex;
import com.photoorg.app.index.FileRecord;
import com.photoorg.app.index.FileStatus;
import com.photoorg.app.index.SessionRow;
import com.photoorg.app.scan.MediaType;

/**
 * Totais do índice: por status, por tipo de mídia (só canônicos) e por ano de captura.
 */
public record StatsReport(
        long totalRecords,
        Map<FileStatus, Long> byStatus,
        Map<MediaType, Long> byMedia,
        SortedMap<Integer, Long> byYear,
        SessionRow lastSession
) {

    public static StatsReport of(DuplicateIndex index) {
        List<SessionRow> last = index.sessions(1);
        return of(index.records(), last.isEmpty() ? null : last.get(0));
    }

    public static StatsReport of(List<FileRecord> records, SessionRow lastSession) {
        Map<FileStatus, Long> byStatus = new EnumMap<>(FileStatus.class);
        Map<MediaType, Long> byMedia = new EnumMap<>(MediaType.class);
        SortedMap<Integer, Long> byYear = new TreeMap<>();
        for (FileStatus s : FileStatus.values()) byStatus.put(s, 0L);

        for (FileRecord r : records) {
            byStatus.merge(r.status(), 1L, Long::sum);
            if (r.status().isCanonical()) {
                byMedia.merge(r.mediaType(), 1L, Long::sum);
            }
            if (r.status() == FileStatus.ORGANIZED && r.year() != null) {
                byYear.merge(r.year(), 1L, Long::sum);
            }
        }
        return new StatsReport(records.size(), byStatus, byMedia, byYear, lastSession);
    }

    public long count(FileStatus status) {
        return byStatus.getOrDefault(status, 0L);
    }

    public String render() {
        StringBuilder sb = new StringBuilder();
        sb.append("Registros: ").append(totalRecords).append('\n');
        sb.append("Por status:\n");
        byStatus.forEach((s, n) -> sb.append(String.format("  %-10s %d%n", s.dbValue(), n)));
        sb.append("Por tipo (arquivos únicos):\n");
        if (byMedia.isEmpty()) sb.append("  -\n");
        byMedia.forEach((m, n) -> sb.append(String.format("  %-10s %d%n", m.folder(), n)));
        sb.append("Por ano (organizados):\n");
        if (byYear.isEmpty()) sb.append("  -\n");
        byYear.forEach((y, n) -> sb.append(String.format("  %04d       %d%n", y, n)));
        if (lastSession != null) {
            sb.append("Última sessão: #").append(lastSession.id())
              .append(' ').append(lastSession.status())
              .append(" em ").append(lastSession.startedAt())
              .append(lastSession.dryRun() ? " [dry-run]" : "")
              .append('\n');
        }
        return sb.toString();
    }
}
