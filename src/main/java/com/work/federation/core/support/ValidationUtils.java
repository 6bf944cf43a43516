package com.work.federation.core.support;

import com.work.federation.core.exception.MalformedInputException;

import java.time.Duration;
import java.util.regex.Pattern;

/**
 * 参数校验工具类，统一参数校验逻辑，减少代码重复
 */
public final class ValidationUtils {

    /**
     * 账本账户地址：0x + 40 位十六进制。
     */
    private static final Pattern ADDRESS_PATTERN = Pattern.compile("^0x[0-9a-fA-F]{40}$");

    /**
     * 域名称 / 描述符 id 等短标识：字母、数字以及少量分隔符，长度 1~64。
     */
    private static final Pattern IDENTIFIER_PATTERN = Pattern.compile("^[a-zA-Z0-9:._/-]{1,64}$");

    /**
     * service_type 取值（镜像名、k8s 描述符名等）。
     */
    private static final Pattern SERVICE_TYPE_PATTERN = Pattern.compile("^[\\w.-]{1,64}$");

    private static final Pattern URL_PATTERN = Pattern.compile("^https?://[^\\s;]+$");

    private ValidationUtils() {
        throw new AssertionError("工具类不允许实例化");
    }

    /**
     * 校验字符串参数不为空
     */
    public static String requireNonEmpty(String value, String paramName) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException(paramName + " 不能为空");
        }
        return value;
    }

    /**
     * 校验对象不为null
     */
    public static <T> T requireNonNull(T value, String paramName) {
        if (value == null) {
            throw new IllegalArgumentException(paramName + " 不能为null");
        }
        return value;
    }

    /**
     * 校验Duration必须大于0
     */
    public static Duration requirePositive(Duration duration, String paramName) {
        requireNonNull(duration, paramName);
        if (duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException(paramName + " 必须大于0");
        }
        return duration;
    }

    /**
     * 校验long值必须非负
     */
    public static long requireNonNegative(long value, String paramName) {
        if (value < 0) {
            throw new IllegalArgumentException(paramName + " 不能为负数");
        }
        return value;
    }

    /**
     * 校验账本地址格式。
     */
    public static String requireValidAddress(String address, String paramName) {
        requireNonEmpty(address, paramName);
        if (!ADDRESS_PATTERN.matcher(address).matches()) {
            throw new MalformedInputException(paramName + " 非法，必须是 0x 开头的 40 位十六进制地址");
        }
        return address;
    }

    /**
     * 外部输入的短标识校验：长度 1~64，仅允许 [a-zA-Z0-9:._/-]。
     * <p>与 requireNonEmpty 不同，格式错误属于 MalformedInput，而不是编程错误。</p>
     */
    public static String requireValidIdentifier(String value, String paramName) {
        if (value == null || value.trim().isEmpty()) {
            throw new MalformedInputException(paramName + " 不能为空");
        }
        if (!IDENTIFIER_PATTERN.matcher(value).matches()) {
            throw new MalformedInputException(paramName + " 非法，只允许 1~64 位的字母、数字、':'、'.'、'_'、'/'、'-'");
        }
        return value;
    }

    public static String requireValidServiceType(String serviceType) {
        if (serviceType == null || !SERVICE_TYPE_PATTERN.matcher(serviceType).matches()) {
            throw new MalformedInputException("service_type 非法: " + serviceType);
        }
        return serviceType;
    }

    /**
     * catalog / topology 端点必须是 http(s) URL，且不能包含 requirements 分隔符 ';'。
     */
    public static String requireValidUrl(String url, String paramName) {
        if (url == null || !URL_PATTERN.matcher(url).matches()) {
            throw new MalformedInputException(paramName + " 必须是 http(s) URL: " + url);
        }
        return url;
    }
}
