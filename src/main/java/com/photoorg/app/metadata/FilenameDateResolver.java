package com.photoorg.app.metadata;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Data a partir do nome do arquivo: remove prefixos de câmera (IMG_, DSC_, PXL_...)
 * e procura {@code yyyyMMdd}, {@code yyyy-MM-dd} ou {@code yyyy_MM_dd}.
 */
public final class FilenameDateResolver implements DateResolver {

    public static final int MIN_YEAR = 1990;

    // separador igual nas duas posições; sem dígitos colados antes ou depois
    private static final Pattern DATE = Pattern.compile("(?<!\\d)(\\d{4})([-_]?)(\\d{2})\\2(\\d{2})(?!\\d)");

    private final List<String> prefixes;
    private final Clock clock;

    public FilenameDateResolver(List<String> prefixes) {
        this(prefixes, Clock.systemDefaultZone());
    }

    public FilenameDateResolver(List<String> prefixes, Clock clock) {
        // prefixos mais longos primeiro: "DSCF" antes de "DSC"
        this.prefixes = prefixes == null ? List.of() : prefixes.stream()
                .filter(p -> p != null && !p.isEmpty())
                .sorted(Comparator.comparingInt(String::length).reversed())
                .toList();
        this.clock = clock;
    }

    @Override
    public Optional<CaptureDate> resolve(Path file) {
        if (file == null || file.getFileName() == null) return Optional.empty();
        return parse(file.getFileName().toString());
    }

    public Optional<CaptureDate> parse(String fileName) {
        String name = stripPrefix(fileName);
        int maxYear = LocalDate.now(clock).getYear() + 1;

        Matcher m = DATE.matcher(name);
        while (m.find()) {
            int year = Integer.parseInt(m.group(1));
            int month = Integer.parseInt(m.group(3));
            int day = Integer.parseInt(m.group(4));
            if (year < MIN_YEAR || year > maxYear) continue;
            // 20231345 e afins: continua procurando
            if (month < 1 || month > 12) continue;
            if (day < 1 || day > YearMonth.of(year, month).lengthOfMonth()) continue;
            return Optional.of(new CaptureDate(year, month));
        }
        return Optional.empty();
    }

    String stripPrefix(String fileName) {
        for (String p : prefixes) {
            if (fileName.regionMatches(true, 0, p, 0, p.length())) {
                return fileName.substring(p.length());
            }
        }
        return fileName;
    }
}
