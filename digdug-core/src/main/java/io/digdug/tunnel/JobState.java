/*
 * The MIT License
 *
 * Copyright 2025 Karate Labs Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.digdug.tunnel;

import java.util.List;
import java.util.Map;

/**
 * The outcome of a remote test session as reported to the provider dashboard.
 * Only {@code success} is required; the other fields are sent when the provider supports them.
 *
 * @param success    whether the job passed
 * @param name       a display name for the job
 * @param buildId    the build the job belongs to
 * @param status     a free-form status message
 * @param tags       tags (or groups) to attach
 * @param extra      arbitrary data to attach
 * @param visibility "public", "private", "team" and similar, where supported
 */
public record JobState(
        boolean success,
        String name,
        String buildId,
        String status,
        List<String> tags,
        Map<String, Object> extra,
        String visibility
) {

    public JobState {
        tags = tags == null ? List.of() : List.copyOf(tags);
        extra = extra == null ? Map.of() : Map.copyOf(extra);
    }

    public static JobState passed() {
        return new JobState(true, null, null, null, null, null, null);
    }

    public static JobState failed() {
        return new JobState(false, null, null, null, null, null, null);
    }

    public static Builder builder(boolean success) {
        return new Builder(success);
    }

    public static class Builder {

        private final boolean success;
        private String name;
        private String buildId;
        private String status;
        private List<String> tags;
        private Map<String, Object> extra;
        private String visibility;

        private Builder(boolean success) {
            this.success = success;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder buildId(String buildId) {
            this.buildId = buildId;
            return this;
        }

        public Builder status(String status) {
            this.status = status;
            return this;
        }

        public Builder tags(List<String> tags) {
            this.tags = tags;
            return this;
        }

        public Builder extra(Map<String, Object> extra) {
            this.extra = extra;
            return this;
        }

        public Builder visibility(String visibility) {
            this.visibility = visibility;
            return this;
        }

        public JobState build() {
            return new JobState(success, name, buildId, status, tags, extra, visibility);
        }

    }

}
