package com.photoorg.app.scan;

import java.util.concurrent.atomic.LongAdder;

public final class ScanMetrics {
    public final LongAdder candidates = new LongAdder();
    public final LongAdder dirsSkipped = new LongAdder();
    public final LongAdder filesSkipped = new LongAdder();
    public final LongAdder scanErrors = new LongAdder();
}
