package cull.email.app.config;

import cull.email.app.entity.DayConversion;
import cull.email.app.entity.RuleSet;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * cull-email configuration properties
 */
@Data
@Component
@ConfigurationProperties(prefix = "cull")
public class CullProperties {

    private String rulesFile = System.getProperty("user.home") + "/.cull-gmail/rules.toml";
    private int pageSize = 200; // ids per search page, Gmail allows up to 500
    private int maxPages = 0; // 0 = until the last page
    private int batchSize = 1000; // Gmail batchModify/batchDelete limit
    private int disposalConcurrency = 4;
    private String markerPrefix = RuleSet.DEFAULT_MARKER_PREFIX;

    private Query query = new Query();
    private Gmail gmail = new Gmail();

    @Data
    public static class Query {
        private int daysPerMonth = 30;
        private int daysPerYear = 365;

        public DayConversion toDayConversion() {
            return new DayConversion(daysPerMonth, daysPerYear);
        }
    }

    @Data
    public static class Gmail {
        private String userId = "me";
        private String applicationName = "Cull Email";
    }
}
