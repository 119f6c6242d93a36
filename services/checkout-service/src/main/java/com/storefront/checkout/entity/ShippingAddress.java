package com.storefront.checkout.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

/**
 * Address as captured at checkout. Copied onto the order so later edits to the
 * customer's address book never change a placed order.
 */
@Embeddable
public class ShippingAddress {

    @Column(name = "ship_name", nullable = false)
    private String name;

    @Column(name = "ship_email", nullable = false)
    private String email;

    @Column(name = "ship_phone", nullable = false)
    private String phone;

    @Column(name = "ship_line1", nullable = false)
    private String line1;

    @Column(name = "ship_line2")
    private String line2;

    @Column(name = "ship_city", nullable = false)
    private String city;

    @Column(name = "ship_state", nullable = false)
    private String state;

    @Column(name = "ship_pincode", nullable = false)
    private String pincode;

    protected ShippingAddress() {}

    public ShippingAddress(String name, String email, String phone, String line1, String line2,
                           String city, String state, String pincode) {
        this.name = name;
        this.email = email;
        this.phone = phone;
        this.line1 = line1;
        this.line2 = line2;
        this.city = city;
        this.state = state;
        this.pincode = pincode;
    }

    public String getName() { return name; }
    public String getEmail() { return email; }
    public String getPhone() { return phone; }
    public String getLine1() { return line1; }
    public String getLine2() { return line2; }
    public String getCity() { return city; }
    public String getState() { return state; }
    public String getPincode() { return pincode; }
}
