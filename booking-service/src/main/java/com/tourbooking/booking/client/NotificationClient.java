package com.tourbooking.booking.client;

import com.tourbooking.booking.client.dto.TicketDeliveryRequest;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;

@FeignClient(name = "notification-service", url = "${booking.clients.notification-service.url}",
        path = "/api/v1/notifications")
public interface NotificationClient {

    @PostMapping("/tickets")
    void sendTickets(@RequestBody TicketDeliveryRequest request);
}
