package com.example.excelcompare;

import com.example.excelcompare.cli.ExcelCompareCli;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.util.Arrays;

@SpringBootApplication
public class ExcelCompareApplication {

    public static void main(String[] args) {
        // java -jar excel-compare-tool.jar compare a.xlsx b.xlsx --keys id
        if (args.length > 0 && ExcelCompareCli.COMMAND.equals(args[0])) {
            System.exit(new ExcelCompareCli().run(Arrays.copyOfRange(args, 1, args.length)));
        }
        SpringApplication.run(ExcelCompareApplication.class, args);
    }
}
