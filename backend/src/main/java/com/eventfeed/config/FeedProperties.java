package com.eventfeed.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "feed")
public class FeedProperties {
    private static final String DEFAULT_USER_AGENT =
        "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0 Safari/537.36";

    private String userAgent;
    private int requestTimeoutSeconds = 15;
    private int calendarTimeoutSeconds = 30;
    private String bypassHeaderName = "x-wdsoit-bot-bypass";
    private String bypassHeaderValue = "1";
    private Enrichment enrichment = new Enrichment();
    private Cli cli = new Cli();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
    }

    public int getCalendarTimeoutSeconds() {
        return Math.max(1, calendarTimeoutSeconds);
    }

    public void setCalendarTimeoutSeconds(int calendarTimeoutSeconds) {
        this.calendarTimeoutSeconds = Math.max(1, calendarTimeoutSeconds);
    }

    public String getBypassHeaderName() {
        return bypassHeaderName;
    }

    public void setBypassHeaderName(String bypassHeaderName) {
        this.bypassHeaderName = bypassHeaderName;
    }

    public String getBypassHeaderValue() {
        return bypassHeaderValue;
    }

    public void setBypassHeaderValue(String bypassHeaderValue) {
        this.bypassHeaderValue = bypassHeaderValue;
    }

    public Enrichment getEnrichment() {
        return enrichment;
    }

    public void setEnrichment(Enrichment enrichment) {
        this.enrichment = enrichment;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Enrichment {
        private Toggle titles = new Toggle();
        private Content content = new Content();
        private Toggle rawDetails = new Toggle();
        private Toggle rawExtracts = Toggle.enabledByDefault();
        private TitleFallback titleFallback = new TitleFallback();

        public Toggle getTitles() {
            return titles;
        }

        public void setTitles(Toggle titles) {
            this.titles = titles;
        }

        public Content getContent() {
            return content;
        }

        public void setContent(Content content) {
            this.content = content;
        }

        public Toggle getRawDetails() {
            return rawDetails;
        }

        public void setRawDetails(Toggle rawDetails) {
            this.rawDetails = rawDetails;
        }

        public Toggle getRawExtracts() {
            return rawExtracts;
        }

        public void setRawExtracts(Toggle rawExtracts) {
            this.rawExtracts = rawExtracts;
        }

        public TitleFallback getTitleFallback() {
            return titleFallback;
        }

        public void setTitleFallback(TitleFallback titleFallback) {
            this.titleFallback = titleFallback;
        }
    }

    public static class Toggle {
        private boolean enabled;
        private boolean overwrite;

        static Toggle enabledByDefault() {
            Toggle toggle = new Toggle();
            toggle.setEnabled(true);
            return toggle;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public boolean isOverwrite() {
            return overwrite;
        }

        public void setOverwrite(boolean overwrite) {
            this.overwrite = overwrite;
        }
    }

    public static class Content extends Toggle {
        private String format = "text";

        public String getFormat() {
            return format;
        }

        public void setFormat(String format) {
            this.format = format;
        }
    }

    public static class TitleFallback extends Toggle {
        private String prefixTemplate = "";

        public String getPrefixTemplate() {
            return prefixTemplate;
        }

        public void setPrefixTemplate(String prefixTemplate) {
            this.prefixTemplate = prefixTemplate;
        }
    }

    public static class Cli {
        private boolean run;
        private String icsUrl = "https://example.com/calendar.ics";
        private String output = "events.json";
        private String config;
        private boolean printOnly;
        private Integer limit;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getIcsUrl() {
            return icsUrl;
        }

        public void setIcsUrl(String icsUrl) {
            this.icsUrl = icsUrl;
        }

        public String getOutput() {
            return output;
        }

        public void setOutput(String output) {
            this.output = output;
        }

        public String getConfig() {
            return config;
        }

        public void setConfig(String config) {
            this.config = config;
        }

        public boolean isPrintOnly() {
            return printOnly;
        }

        public void setPrintOnly(boolean printOnly) {
            this.printOnly = printOnly;
        }

        public Integer getLimit() {
            return limit;
        }

        public void setLimit(Integer limit) {
            this.limit = limit == null ? null : Math.max(0, limit);
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
