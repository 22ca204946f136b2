package com.communitybot.service;

/**
 * Receives side-effect failures the engines do not roll back.
 */
public interface DeliveryListener {
    void onDeliveryFailure(DeliveryFailure failure);
}
