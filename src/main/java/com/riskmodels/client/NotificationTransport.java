package com.riskmodels.client;

import com.riskmodels.dto.NotificationMessage;

public interface NotificationTransport {

    void send(NotificationMessage message);
}
