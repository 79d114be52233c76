package com.edtech.auth.util;

import java.util.regex.Pattern;

public final class IdentifierValidator {

    private static final Pattern PHONE_PATTERN = Pattern.compile("^\\+[1-9]\\d{6,14}$");
    private static final Pattern EMAIL_PATTERN = Pattern.compile("^[A-Z0-9._%+-]+@[A-Z0-9.-]+\\.[A-Z]{2,}$", Pattern.CASE_INSENSITIVE);
    private static final Pattern USERNAME_PATTERN = Pattern.compile("^[a-z0-9_.]{3,20}$");

    private IdentifierValidator() {
    }

    /**
     * 校验手机号格式（E.164：加号、国家码与号码，共 8 至 16 位）。
     *
     * @param phone 已标准化的手机号字符串。
     * @return 是否匹配手机号正则。
     */
    public static boolean isValidPhone(String phone) {
        return phone != null && PHONE_PATTERN.matcher(phone).matches();
    }

    /**
     * 校验邮箱格式（大小写不敏感）。
     *
     * @param email 邮箱字符串。
     * @return 是否匹配邮箱正则。
     */
    public static boolean isValidEmail(String email) {
        return email != null && EMAIL_PATTERN.matcher(email).matches();
    }

    /**
     * 校验用户名：3 至 20 位小写字母、数字、下划线或点。
     *
     * @param username 已转小写的用户名。
     * @return 是否合法。
     */
    public static boolean isValidUsername(String username) {
        return username != null && USERNAME_PATTERN.matcher(username).matches();
    }
}
