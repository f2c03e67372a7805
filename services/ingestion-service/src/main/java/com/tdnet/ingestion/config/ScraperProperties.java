package com.tdnet.ingestion.config;

import com.tdnet.common.storage.LayoutMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "scraper")
public class ScraperProperties {

    @NotBlank
    private String serviceRoot = "https://www.release.tdnet.info/inbs";
    private String userAgent = "Mozilla/5.0 (compatible; TdnetDisclosureBot/1.0)";
    @NotNull
    private Duration pageTimeout = Duration.ofSeconds(10);
    @NotNull
    private Duration downloadTimeout = Duration.ofSeconds(30);
    @Min(1)
    private int pageMaxInMemoryMb = 4;
    @NotNull
    private LayoutMode layout = LayoutMode.DATE;
    private List<String> excludedMarkets = new ArrayList<>(List.of(
        "ETF・ETN",
        "PRO Market",
        "REIT・ベンチャーファンド・カントリーファンド・インフラファンド",
        "出資証券",
        "プライム（外国株式）",
        "スタンダード（外国株式）",
        "グロース（外国株式）"
    ));
    @Valid
    private RateLimit rateLimit = new RateLimit();
    @Valid
    private Transfer transfer = new Transfer();
    @Valid
    private Scheduler scheduler = new Scheduler();

    public String getServiceRoot() {
        return serviceRoot;
    }

    public void setServiceRoot(String serviceRoot) {
        this.serviceRoot = serviceRoot;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = userAgent;
    }

    public Duration getPageTimeout() {
        return pageTimeout;
    }

    public void setPageTimeout(Duration pageTimeout) {
        this.pageTimeout = pageTimeout;
    }

    public Duration getDownloadTimeout() {
        return downloadTimeout;
    }

    public void setDownloadTimeout(Duration downloadTimeout) {
        this.downloadTimeout = downloadTimeout;
    }

    public int getPageMaxInMemoryMb() {
        return pageMaxInMemoryMb;
    }

    public void setPageMaxInMemoryMb(int pageMaxInMemoryMb) {
        this.pageMaxInMemoryMb = pageMaxInMemoryMb;
    }

    public LayoutMode getLayout() {
        return layout;
    }

    public void setLayout(LayoutMode layout) {
        this.layout = layout;
    }

    public List<String> getExcludedMarkets() {
        return excludedMarkets;
    }

    public void setExcludedMarkets(List<String> excludedMarkets) {
        this.excludedMarkets = excludedMarkets;
    }

    public RateLimit getRateLimit() {
        return rateLimit;
    }

    public void setRateLimit(RateLimit rateLimit) {
        this.rateLimit = rateLimit;
    }

    public Transfer getTransfer() {
        return transfer;
    }

    public void setTransfer(Transfer transfer) {
        this.transfer = transfer;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public static class RateLimit {

        @Min(1)
        private int maxRequestsPerSecond = 5;

        public int getMaxRequestsPerSecond() {
            return maxRequestsPerSecond;
        }

        public void setMaxRequestsPerSecond(int maxRequestsPerSecond) {
            this.maxRequestsPerSecond = maxRequestsPerSecond;
        }
    }

    public static class Transfer {

        @Min(1)
        private int maxWorkers = 5;
        @Min(1)
        private int batchSize = 50;

        public int getMaxWorkers() {
            return maxWorkers;
        }

        public void setMaxWorkers(int maxWorkers) {
            this.maxWorkers = maxWorkers;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }
    }

    public static class Scheduler {

        private boolean enabled = false;
        @NotBlank
        private String cron = "0 0 19 * * MON-FRI";
        @NotBlank
        private String zone = "Asia/Tokyo";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getCron() {
            return cron;
        }

        public void setCron(String cron) {
            this.cron = cron;
        }

        public String getZone() {
            return zone;
        }

        public void setZone(String zone) {
            this.zone = zone;
        }
    }
}
