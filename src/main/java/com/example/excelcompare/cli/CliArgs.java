package com.example.excelcompare.cli;

import java.util.ArrayList;
import java.util.List;

public record CliArgs(
        String file1,
        String file2,
        String sheet1,
        String sheet2,
        List<String> keys,
        String output,
        String markedDir
) {
    static final String DEFAULT_SHEET = "Sheet1";

    public static CliArgs parse(String[] args) {
        List<String> positional = new ArrayList<>();
        List<String> keys = new ArrayList<>();
        String sheet1 = DEFAULT_SHEET;
        String sheet2 = DEFAULT_SHEET;
        String output = null;
        String markedDir = null;

        if (args == null) {
            args = new String[0];
        }
        for (int i = 0; i < args.length; i++) {
            String a = args[i] == null ? "" : args[i].trim();
            if (!a.startsWith("--")) {
                if (!a.isEmpty()) {
                    positional.add(a);
                }
                continue;
            }

            String k;
            String v = null;
            int eq = a.indexOf('=');
            if (eq > 2) {
                k = a.substring(2, eq).trim();
                v = a.substring(eq + 1).trim();
            } else {
                k = a.substring(2).trim();
            }

            if (k.equals("keys")) {
                if (v != null) {
                    keys.add(v);
                }
                // nargs=+ : 读取到下一个选项为止
                while (i + 1 < args.length && args[i + 1] != null && !args[i + 1].startsWith("--")) {
                    keys.add(args[++i].trim());
                }
                continue;
            }

            if (v == null) {
                if (i + 1 >= args.length || args[i + 1] == null || args[i + 1].startsWith("--")) {
                    throw new IllegalArgumentException("选项 --" + k + " 缺少参数值");
                }
                v = args[++i].trim();
            }
            switch (k) {
                case "sheet1" -> sheet1 = v;
                case "sheet2" -> sheet2 = v;
                case "output" -> output = v;
                case "marked-dir" -> markedDir = v;
                default -> throw new IllegalArgumentException("未知选项: --" + k);
            }
        }

        if (positional.size() != 2) {
            throw new IllegalArgumentException("需要两个Excel文件路径，实际为 " + positional.size() + " 个");
        }
        keys.removeIf(String::isBlank);
        if (keys.isEmpty()) {
            throw new IllegalArgumentException("缺少必需选项 --keys");
        }
        return new CliArgs(positional.get(0), positional.get(1), sheet1, sheet2, List.copyOf(keys), output, markedDir);
    }

    static String usage() {
        return "用法: compare <file1> <file2> --keys <列名> [<列名> ...] "
                + "[--sheet1 <名称>] [--sheet2 <名称>] [--output <日志文件>] [--marked-dir <目录>]";
    }
}
