package com.reservepolicy.engine.state;

import com.reservepolicy.common.math.StakeMath;
import com.reservepolicy.common.model.HealthLevel;

import java.util.Map;
import java.util.TreeMap;

/**
 * Reserve custody snapshot: units held, liabilities outstanding, target weights
 * and the last health figures computed by the monitor.
 */
public class ReserveVault {

    private long reserveUnits;
    private long liabilities;
    private long lastVhrBps = Long.MAX_VALUE;
    private HealthLevel lastHealth = HealthLevel.HEALTHY;
    private Map<String, Integer> targetWeightsBps = Map.of();
    private Long lastRebalanceAt;

    public ReserveVault copy() {
        ReserveVault c = new ReserveVault();
        c.reserveUnits     = reserveUnits;
        c.liabilities      = liabilities;
        c.lastVhrBps       = lastVhrBps;
        c.lastHealth       = lastHealth;
        c.targetWeightsBps = targetWeightsBps;
        c.lastRebalanceAt  = lastRebalanceAt;
        return c;
    }

    public void deposit(long units) {
        reserveUnits = StakeMath.checkedAdd(reserveUnits, units);
    }

    public void withdraw(long units) {
        reserveUnits = StakeMath.checkedSub(reserveUnits, units);
    }

    public void increaseLiabilities(long amount) {
        liabilities = StakeMath.checkedAdd(liabilities, amount);
    }

    public void decreaseLiabilities(long amount) {
        liabilities = StakeMath.checkedSub(liabilities, amount);
    }

    public void rebalance(Map<String, Integer> weights, long at) {
        this.targetWeightsBps = Map.copyOf(new TreeMap<>(weights));
        this.lastRebalanceAt  = at;
    }

    public void recordHealth(long vhrBps, HealthLevel level) {
        this.lastVhrBps = vhrBps;
        this.lastHealth = level;
    }

    public long getReserveUnits()                 { return reserveUnits; }
    public long getLiabilities()                  { return liabilities; }
    public long getLastVhrBps()                   { return lastVhrBps; }
    public HealthLevel getLastHealth()            { return lastHealth; }
    public Map<String, Integer> getTargetWeightsBps() { return targetWeightsBps; }
    public Long getLastRebalanceAt()              { return lastRebalanceAt; }
}
