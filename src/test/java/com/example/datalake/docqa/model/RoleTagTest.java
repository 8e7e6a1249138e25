package com.example.datalake.docqa.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class RoleTagTest {

  @Test
  void acceptsCodesAndEnumNames() {
    assertThat(RoleTag.fromCode("customer")).isEqualTo(RoleTag.EXTERNAL);
    assertThat(RoleTag.fromCode("EXTERNAL")).isEqualTo(RoleTag.EXTERNAL);
    assertThat(RoleTag.fromCode("business_owner")).isEqualTo(RoleTag.OWNER);
    assertThat(RoleTag.fromCode("employee")).isEqualTo(RoleTag.STAFF);
  }

  @Test
  void rejectsUnknownRoles() {
    assertThatThrownBy(() -> RoleTag.fromCode("admin")).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> RoleTag.fromCode(" ")).isInstanceOf(IllegalArgumentException.class);
  }
}
