package com.tdnet.ingestion.classify;

import static org.assertj.core.api.Assertions.assertThat;

import com.tdnet.common.disclosure.DocType;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

class DocumentClassifierTest {

    private final DocumentClassifier classifier = new DocumentClassifier();

    @ParameterizedTest
    @CsvSource({
        "2024年3月期 第3四半期決算短信〔日本基準〕(連結), TANSHIN",
        "業績予想の修正に関するお知らせ, TANSHIN",
        "2024年3月期 決算説明資料, TANSHIN",
        "中期経営計画 説明資料, PRESENTATION",
        "Supplementary Materials for Q3, PRESENTATION",
        "剰余金の配当に関するお知らせ, DIVIDEND",
        "Notice of Dividend Increase, DIVIDEND",
        "代表取締役の異動（変更）に関するお知らせ, OTHER",
        "(訂正)「有価証券報告書」の一部訂正, OTHER",
        "Consolidated Financial Results for FY2023, TANSHIN"
    })
    void classifiesByFirstMatchingGroup(String title, DocType expected) {
        assertThat(classifier.classify(title)).contains(expected);
    }

    @ParameterizedTest
    @ValueSource(strings = {"自己株式の取得状況に関するお知らせ", "株主総会招集通知"})
    void unmatchedTitlesAreExcluded(String title) {
        assertThat(classifier.classify(title)).isEmpty();
    }

    @ParameterizedTest
    @NullAndEmptySource
    void blankTitlesAreExcluded(String title) {
        assertThat(classifier.classify(title)).isEmpty();
    }

    @Test
    void matchingIsCaseInsensitive() {
        assertThat(classifier.classify("EARNINGS CALL TRANSCRIPT")).contains(DocType.TANSHIN);
    }
}
