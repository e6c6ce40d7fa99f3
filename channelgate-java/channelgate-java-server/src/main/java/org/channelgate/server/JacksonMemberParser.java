/*
 * Copyright (c) 2008-2022 the original author or authors.
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
 */
package org.channelgate.server;

import java.io.IOException;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>Parses the presence member data returned by the authenticator.</p>
 * <p>Member data that is a JSON string is parsed into maps, lists and
 * scalars; any other value, or a string that is not valid JSON, is
 * returned as is.</p>
 * <p>Content after the first JSON value makes the whole string invalid.</p>
 */
public class JacksonMemberParser {
    private static final Logger _logger = LoggerFactory.getLogger(JacksonMemberParser.class);

    private final ObjectMapper objectMapper;
    private final ObjectReader reader;

    public JacksonMemberParser() {
        this(new ObjectMapper());
    }

    public JacksonMemberParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.reader = objectMapper.readerFor(Object.class).with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    public Object parse(Object channelData) {
        if (!(channelData instanceof String)) {
            return channelData;
        }
        String json = (String)channelData;
        try {
            return reader.readValue(json);
        } catch (IOException x) {
            if (_logger.isDebugEnabled()) {
                _logger.debug("Could not parse member data, using raw value: {}", json, x);
            }
            return json;
        }
    }
}
