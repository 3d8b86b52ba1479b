package com.chicu.aimodelops.web.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RetrainCommand {

    /** Свободный комментарий оператора. */
    private String detail;
}
