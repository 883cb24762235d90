package com.xbleey.marketreport.task;

import com.xbleey.marketreport.config.ReportTaskProperties;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ReportExtractorTest {

    private final ReportExtractor extractor = ReportExtractor.from(new ReportTaskProperties.CommandDefinition());

    @Test
    void takesTextBetweenStartAndEndMarkers() {
        String output = "正在获取数据...\n分析报告:\n\n报告内容\n第二行\n\n===== DONE =====\n";

        assertThat(extractor.extract(output)).contains("报告内容\n第二行");
    }

    @Test
    void missingEndMarkerTakesRestOfOutput() {
        String output = "log\n分析报告:\n\n  今日资金面平稳  \n";

        assertThat(extractor.extract(output)).contains("今日资金面平稳");
    }

    @Test
    void fallsBackToKeywordLinesInOrder() {
        String output = """
                开始分析
                  行业资金流入最多: 半导体
                无关日志
                涨幅最大: 中芯国际
                跌幅最大: 某银行
                """;

        assertThat(extractor.extract(output)).contains("行业资金流入最多: 半导体\n涨幅最大: 中芯国际\n跌幅最大: 某银行");
    }

    @Test
    void fallsBackToHeadOfRawOutput() {
        String output = "x".repeat(1500);

        assertThat(extractor.extract(output)).contains("x".repeat(1000));
    }

    @Test
    void shortRawOutputIsReturnedWhole() {
        assertThat(extractor.extract("just some text")).contains("just some text");
    }

    @Test
    void blankOutputYieldsNothing() {
        assertThat(extractor.extract("  \n ")).isEmpty();
        assertThat(extractor.extract(null)).isEmpty();
    }

    @Test
    void emptyMarkedBlockYieldsNoReport() {
        String output = "成交量最大: 平安银行\n分析报告:\n\n\n\n===== DONE =====";

        assertThat(extractor.extract(output)).isEmpty();
    }

    @Test
    void blankMarkedBlockDoesNotFallBackToRawHead() {
        String output = "loading data...\n分析报告:\n\n   \n\n===== 程序执行完毕 =====";

        assertThat(extractor.extract(output)).isEmpty();
    }

    @Test
    void headNeverSplitsASurrogatePair() {
        String output = "x".repeat(999) + "\uD83D\uDE00" + "y".repeat(600);

        assertThat(extractor.extract(output)).contains("x".repeat(999));
    }
}
