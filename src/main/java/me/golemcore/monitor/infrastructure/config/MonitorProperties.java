package me.golemcore.monitor.infrastructure.config;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.monitor.domain.model.PollConfig;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration properties for the attachment monitor, bound from
 * application.properties under the {@code monitor.*} prefix.
 *
 * <ul>
 * <li>keyword, lookback and interval - default poll settings</li>
 * <li>{@link StorageProperties} - dedup store location</li>
 * <li>{@link ImapProperties} - IMAP mail source</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "monitor")
@Data
public class MonitorProperties {

    private String keyword = "varun";
    private int lookbackDays = 1;
    private int intervalSeconds = 300;
    private boolean autoStart = false;

    /** Upper bound for a single mail source fetch. */
    private Duration fetchTimeout = Duration.ofSeconds(60);

    /** Worker threads evaluating the messages of one cycle. */
    private int evaluationThreads = Runtime.getRuntime().availableProcessors();

    private int bodyPreviewLength = 2000;

    private StorageProperties storage = new StorageProperties();
    private ImapProperties imap = new ImapProperties();

    public PollConfig toPollConfig() {
        return new PollConfig(keyword, lookbackDays, intervalSeconds);
    }

    @Data
    public static class StorageProperties {
        private String basePath = "${user.home}/.golemcore/attachment-monitor";
    }

    @Data
    public static class ImapProperties {
        private boolean enabled = false;
        private String host = "";
        private int port = 993;
        private String username = "";
        private String password = "";
        private String security = "ssl";
        private String sslTrust = "";
        private int connectTimeout = 10000;
        private int readTimeout = 30000;
        private String folder = "INBOX";
        private int maxMessages = 500;
    }
}
