package com.sensorstream.service.alert;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sensorstream.dto.AlertMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Writes alerts as JSON to the application log, where the log shipper picks them up.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LoggingAlertNotifier implements AlertNotifier {

    private final ObjectMapper objectMapper;

    @Override
    public void notify(AlertMessage alert) {
        try {
            log.warn("ALERT {}", objectMapper.writeValueAsString(alert));
        } catch (JsonProcessingException e) {
            log.error("Error serializing alert for machine {}", alert.getMachineId(), e);
        }
    }
}
