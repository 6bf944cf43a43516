package com.work.federation.core.support;

import com.work.federation.core.exception.MalformedInputException;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 联邦网络子网计算：为每个域从共享的 federation net 中切出一段 /24。
 */
public final class SubnetUtils {

    private static final Pattern CIDR_PATTERN =
            Pattern.compile("^(\\d{1,3})\\.(\\d{1,3})\\.(\\d{1,3})\\.(\\d{1,3})/(\\d{1,2})$");

    private SubnetUtils() {
        throw new AssertionError("工具类不允许实例化");
    }

    /**
     * 用 identifier 替换第三段，生成 /24 子网，例如 (10.0.0.0/16, 3) -> 10.0.3.0/24。
     */
    public static String createSmallerSubnet(String originalCidr, int identifier) {
        int[] octets = parse(originalCidr);
        if (identifier < 0 || identifier > 255) {
            throw new MalformedInputException("subnet identifier 超出范围 0~255: " + identifier);
        }
        return octets[0] + "." + octets[1] + "." + identifier + "." + octets[3] + "/24";
    }

    /**
     * 返回子网中可分配主机的范围 "first-last"（跳过网络地址与广播地址）。
     */
    public static String ipRange(String cidr) {
        int[] octets = parse(cidr);
        int prefix = octets[4];
        if (prefix > 30) {
            throw new MalformedInputException("子网过小，无可分配主机: " + cidr);
        }
        long ip = ((long) octets[0] << 24) | ((long) octets[1] << 16) | ((long) octets[2] << 8) | octets[3];
        long mask = prefix == 0 ? 0L : (0xFFFFFFFFL << (32 - prefix)) & 0xFFFFFFFFL;
        long network = ip & mask;
        long broadcast = network | (~mask & 0xFFFFFFFFL);
        return toDotted(network + 1) + "-" + toDotted(broadcast - 1);
    }

    private static int[] parse(String cidr) {
        if (cidr == null) {
            throw new MalformedInputException("subnet 不能为空");
        }
        Matcher m = CIDR_PATTERN.matcher(cidr.trim());
        if (!m.matches()) {
            throw new MalformedInputException("subnet 不是合法的 CIDR: " + cidr);
        }
        int[] out = new int[5];
        for (int i = 0; i < 5; i++) {
            out[i] = Integer.parseInt(m.group(i + 1));
        }
        for (int i = 0; i < 4; i++) {
            if (out[i] > 255) {
                throw new MalformedInputException("subnet 不是合法的 CIDR: " + cidr);
            }
        }
        if (out[4] > 32) {
            throw new MalformedInputException("subnet 前缀长度非法: " + cidr);
        }
        return out;
    }

    private static String toDotted(long ip) {
        return ((ip >> 24) & 0xFF) + "." + ((ip >> 16) & 0xFF) + "." + ((ip >> 8) & 0xFF) + "." + (ip & 0xFF);
    }
}
