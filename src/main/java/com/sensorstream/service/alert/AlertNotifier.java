package com.sensorstream.service.alert;

import com.sensorstream.dto.AlertMessage;

/**
 * Fire-and-continue destination for anomaly alerts.
 */
@FunctionalInterface
public interface AlertNotifier {

    void notify(AlertMessage alert);
}
