package com.baykanat.signoff.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** dc_users satırı. ccoId "<id>@domain" formatındadır ve hiyerarşi eşleşmesinde kullanılır. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DcUser {

    private Long userId;
    private String userTitle;
    private String ccoId;
    private boolean deleted;
}
