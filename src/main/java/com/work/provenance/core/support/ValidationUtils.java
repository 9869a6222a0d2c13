package com.work.provenance.core.support;

import com.work.provenance.core.exception.InvalidInputException;

import java.math.BigInteger;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 参数校验工具类，统一参数校验与规范化逻辑。
 * <p>地址统一规范为小写的 {@code 0x} + 40 位十六进制，bytes32 统一规范为小写的 {@code 0x} + 64 位十六进制，
 * 之后所有存储键、签名载荷都使用规范化后的值。</p>
 */
public final class ValidationUtils {

    public static final String ZERO_ADDRESS = "0x0000000000000000000000000000000000000000";
    public static final String ZERO_BYTES32 = "0x0000000000000000000000000000000000000000000000000000000000000000";
    public static final BigInteger MAX_UINT256 = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);

    private static final Pattern ADDRESS_PATTERN = Pattern.compile("^0x[0-9a-f]{40}$");
    private static final Pattern BYTES32_PATTERN = Pattern.compile("^0x[0-9a-f]{64}$");

    private ValidationUtils() {
        throw new AssertionError("工具类不允许实例化");
    }

    /**
     * 校验字符串参数不为空
     */
    public static String requireNonEmpty(String value, String paramName) {
        if (value == null || value.trim().isEmpty()) {
            throw new InvalidInputException("empty " + paramName, paramName + " 不能为空");
        }
        return value;
    }

    /**
     * 校验对象不为null
     */
    public static <T> T requireNonNull(T value, String paramName) {
        if (value == null) {
            throw new InvalidInputException("null " + paramName, paramName + " 不能为null");
        }
        return value;
    }

    /**
     * 校验long值必须非负
     */
    public static long requireNonNegative(long value, String paramName) {
        if (value < 0) {
            throw new InvalidInputException("negative " + paramName, paramName + " 不能为负数");
        }
        return value;
    }

    /**
     * 校验并规范化地址，允许零地址。
     */
    public static String requireAddress(String value, String paramName) {
        requireNonEmpty(value, paramName);
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (!ADDRESS_PATTERN.matcher(normalized).matches()) {
            throw new InvalidInputException("bad " + paramName, paramName + " 不是合法地址: " + value);
        }
        return normalized;
    }

    /**
     * 校验并规范化地址，零地址视为缺失。
     */
    public static String requireNonZeroAddress(String value, String paramName) {
        String normalized = requireAddress(value, paramName);
        if (ZERO_ADDRESS.equals(normalized)) {
            throw new InvalidInputException("zero " + paramName, paramName + " 不能为零地址");
        }
        return normalized;
    }

    /**
     * 校验并规范化 32 字节值（context、release id、merkle root 等），允许零值。
     */
    public static String requireBytes32(String value, String paramName) {
        requireNonEmpty(value, paramName);
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (!BYTES32_PATTERN.matcher(normalized).matches()) {
            throw new InvalidInputException("bad " + paramName, paramName + " 不是合法的 bytes32: " + value);
        }
        return normalized;
    }

    /**
     * 校验并规范化 32 字节值，零值视为缺失。
     */
    public static String requireNonZeroBytes32(String value, String paramName) {
        String normalized = requireBytes32(value, paramName);
        if (ZERO_BYTES32.equals(normalized)) {
            throw new InvalidInputException("zero " + paramName, paramName + " 不能为零值");
        }
        return normalized;
    }

    /**
     * 校验 uint256 取值范围。
     */
    public static BigInteger requireUint256(BigInteger value, String paramName) {
        requireNonNull(value, paramName);
        if (value.signum() < 0 || value.compareTo(MAX_UINT256) > 0) {
            throw new InvalidInputException("bad " + paramName, paramName + " 超出 uint256 范围: " + value);
        }
        return value;
    }

    /**
     * 解析十进制或 {@code 0x} 前缀十六进制的 uint256 字符串。
     */
    public static BigInteger parseUint256(String value, String paramName) {
        requireNonEmpty(value, paramName);
        String v = value.trim();
        try {
            BigInteger parsed = v.startsWith("0x") || v.startsWith("0X")
                    ? new BigInteger(v.substring(2), 16)
                    : new BigInteger(v);
            return requireUint256(parsed, paramName);
        } catch (NumberFormatException e) {
            throw new InvalidInputException("bad " + paramName, paramName + " 不是合法整数: " + value, e);
        }
    }

    public static boolean isZeroBytes32(String value) {
        return value == null || ZERO_BYTES32.equalsIgnoreCase(value.trim());
    }
}
