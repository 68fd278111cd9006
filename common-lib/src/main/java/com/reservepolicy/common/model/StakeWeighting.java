package com.reservepolicy.common.model;

/**
 * How a vote's stake converts into the amount credited to yes/no totals.
 *
 * <ul>
 *   <li>{@link #LINEAR}: credit equals stake</li>
 *   <li>{@link #QUADRATIC}: credit is the integer square root of stake (minimum 1),
 *       dampening large single stakes</li>
 * </ul>
 */
public enum StakeWeighting {
    LINEAR,
    QUADRATIC
}
