package com.takeaway.storefront.dto;

import com.takeaway.storefront.model.User;
import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class UserDto {
    private Long id;
    private String email;
    private String role;

    public static UserDto from(User user) {
        return new UserDto(user.getId(), user.getEmail(), user.getRole());
    }
}
