package com.openfashion.vaultservice.core.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

public class MoneyUtil {

    private MoneyUtil(){}

    public static final int SCALE = 4;
    public static final RoundingMode ROUNDING = RoundingMode.HALF_EVEN;

    public static BigDecimal format(BigDecimal amount) {
        if (amount == null) return BigDecimal.ZERO.setScale(SCALE, ROUNDING);
        return amount.setScale(SCALE, ROUNDING);
    }

    public static boolean covers(BigDecimal available, BigDecimal required) {
        return format(available).compareTo(format(required)) >= 0;
    }

    public static boolean isPositive(BigDecimal amount) {
        return amount != null && amount.signum() > 0;
    }

    // True when formatting would drop no significant digits
    public static boolean fitsScale(BigDecimal amount) {
        return amount == null || amount.stripTrailingZeros().scale() <= SCALE;
    }

}
