package com.baykanat.signoff.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** app.* için tip güvenli configuration (Kafka topic, uyumluluk kuralları, scheduler, sorgu limitleri). */
@Configuration
@ConfigurationProperties(prefix = "app")
@Getter
@Setter
public class AppProperties {

    private KafkaTopicProperties kafka = new KafkaTopicProperties();
    private ComplianceProperties compliance = new ComplianceProperties();
    private SchedulerProperties scheduler = new SchedulerProperties();
    private QueryProperties query = new QueryProperties();

    @Getter
    @Setter
    public static class KafkaTopicProperties {
        private TopicNames topic = new TopicNames();

        @Getter
        @Setter
        public static class TopicNames {
            private String signoffEvents = "signoff-events";
        }
    }

    @Getter
    @Setter
    public static class ComplianceProperties {
        /** dc_typ_signoff_method içindeki "deferred" metodunun id'si. */
        private int deferredMethodId = 7;
        /** Hiyerarşi emp_cco_id'sine eklenip kullanıcı cco_id'siyle karşılaştırılan domain. */
        private String hierarchyEmailDomain = "cisco.com";
        /** As-of zamanının okunduğu saat dilimi. */
        private String zone = "UTC";
    }

    @Getter
    @Setter
    public static class SchedulerProperties {
        /** Rapor yeniden hesaplama aralığı (ms). */
        private long reportRefreshRate = 3600000;
        /** İlk hesaplama gecikmesi (ms); uygulama açılışından sonra. */
        private long reportRefreshInitialDelay = 30000;
        private long cleanupRate = 3600000;
        private int inboxRetentionDays = 7;
        private int reportRunRetentionDays = 14;
    }

    @Getter
    @Setter
    public static class QueryProperties {
        private int defaultPageSize = 50;
        private int maxPageSize = 500;
    }
}
