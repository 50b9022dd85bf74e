package com.gdin.inspection.lodbook.util;

import cn.hutool.core.util.StrUtil;

import java.util.Locale;
import java.util.regex.Pattern;

public class SlugUtil {
    private static final Pattern NON_ALNUM = Pattern.compile("[^\\p{L}\\p{N}]+");

    private SlugUtil() {
    }

    /**
     * "James Minahan" -> "james-minahan"
     */
    public static String slugify(String name) {
        if (StrUtil.isBlank(name)) return "";
        String slug = NON_ALNUM.matcher(name).replaceAll("-");
        while (slug.startsWith("-")) slug = slug.substring(1);
        while (slug.endsWith("-")) slug = slug.substring(0, slug.length() - 1);
        return slug.toLowerCase(Locale.ROOT);
    }
}
