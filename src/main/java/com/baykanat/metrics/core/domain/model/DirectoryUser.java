package com.baykanat.metrics.core.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Harici kullanıcı dizininden okunan kayıt; id = küçük harf email. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DirectoryUser {

    private String email;
    private String role;
    private boolean emailVerified;
    private boolean locked;
}
