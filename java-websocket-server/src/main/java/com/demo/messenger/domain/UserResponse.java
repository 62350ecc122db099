package com.demo.messenger.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserResponse {
    private String username;
    private boolean online;

    public static UserResponse from(UserPresence presence) {
        return new UserResponse(presence.getUsername(), presence.isOnline());
    }
}
