package com.reservepolicy.engine.state;

import com.reservepolicy.common.model.OracleReading;

/**
 * Last admitted oracle values. Timing of the last admission lives in
 * {@link GlobalState}; this holds the values only.
 */
public class OracleState {

    private long indexValue;
    private long avgYieldBps;
    private long volatilityBps;
    private long tvlUsd;
    private long reportedAt;
    private int snapshotCount;

    public OracleState copy() {
        OracleState c = new OracleState();
        c.indexValue    = indexValue;
        c.avgYieldBps   = avgYieldBps;
        c.volatilityBps = volatilityBps;
        c.tvlUsd        = tvlUsd;
        c.reportedAt    = reportedAt;
        c.snapshotCount = snapshotCount;
        return c;
    }

    public void accept(OracleReading reading) {
        this.indexValue    = reading.indexValue();
        this.avgYieldBps   = reading.avgYieldBps();
        this.volatilityBps = reading.volatilityBps();
        this.tvlUsd        = reading.tvlUsd();
        this.reportedAt    = reading.timestamp();
        if (snapshotCount < Integer.MAX_VALUE) {
            snapshotCount++;
        }
    }

    public boolean hasReading() {
        return snapshotCount > 0;
    }

    public long getIndexValue()    { return indexValue; }
    public long getAvgYieldBps()   { return avgYieldBps; }
    public long getVolatilityBps() { return volatilityBps; }
    public long getTvlUsd()        { return tvlUsd; }
    public long getReportedAt()    { return reportedAt; }
    public int getSnapshotCount()  { return snapshotCount; }
}
