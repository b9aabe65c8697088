package com.comparo.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "comparo")
public class ComparoProperties {

    private Dispatch dispatch = new Dispatch();
    private Approval approval = new Approval();
    private Targets targets = new Targets();

    public Dispatch getDispatch() {
        return dispatch;
    }

    public void setDispatch(Dispatch dispatch) {
        this.dispatch = dispatch;
    }

    public Approval getApproval() {
        return approval;
    }

    public void setApproval(Approval approval) {
        this.approval = approval;
    }

    public Targets getTargets() {
        return targets;
    }

    public void setTargets(Targets targets) {
        this.targets = targets;
    }

    public static class Dispatch {

        /** Maximum number of targets invoked at the same time across all requests. */
        private int maxParallel = 8;

        /** Seconds before a running comparison is cancelled; 0 disables the timeout. */
        private long timeoutSeconds = 300;

        public int getMaxParallel() {
            return maxParallel;
        }

        public void setMaxParallel(int maxParallel) {
            this.maxParallel = maxParallel;
        }

        public long getTimeoutSeconds() {
            return timeoutSeconds;
        }

        public void setTimeoutSeconds(long timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }
    }

    public static class Approval {

        /** When true, an approve-all decision also approves later proposals of the same request. */
        private boolean stickyApproveAll = false;

        /** Tool names approved without asking. */
        private List<String> autoApproveTools = new ArrayList<>();

        public boolean isStickyApproveAll() {
            return stickyApproveAll;
        }

        public void setStickyApproveAll(boolean stickyApproveAll) {
            this.stickyApproveAll = stickyApproveAll;
        }

        public List<String> getAutoApproveTools() {
            return autoApproveTools;
        }

        public void setAutoApproveTools(List<String> autoApproveTools) {
            this.autoApproveTools = autoApproveTools;
        }
    }

    public static class Targets {

        private List<Target> catalog = new ArrayList<>();

        /** Targets selected when nothing else has been chosen. */
        private List<String> defaults = new ArrayList<>();

        private int maxSelected = 4;

        public List<Target> getCatalog() {
            return catalog;
        }

        public void setCatalog(List<Target> catalog) {
            this.catalog = catalog;
        }

        public List<String> getDefaults() {
            return defaults;
        }

        public void setDefaults(List<String> defaults) {
            this.defaults = defaults;
        }

        public int getMaxSelected() {
            return maxSelected;
        }

        public void setMaxSelected(int maxSelected) {
            this.maxSelected = maxSelected;
        }
    }

    public static class Target {

        private String id;
        private String name;
        private String provider = "openai";
        private Double temperature;
        private Integer maxTokens;
        private Double topP;

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public Double getTemperature() {
            return temperature;
        }

        public void setTemperature(Double temperature) {
            this.temperature = temperature;
        }

        public Integer getMaxTokens() {
            return maxTokens;
        }

        public void setMaxTokens(Integer maxTokens) {
            this.maxTokens = maxTokens;
        }

        public Double getTopP() {
            return topP;
        }

        public void setTopP(Double topP) {
            this.topP = topP;
        }
    }
}
