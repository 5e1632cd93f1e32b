package com.prophit.insights.synthetic;

import com.prophit.insights.model.Category;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Representative Dublin merchant labels per spending category.
 */
public final class MerchantCatalog {

    private static final Map<Category, List<String>> MERCHANTS = new EnumMap<>(Category.class);

    static {
        MERCHANTS.put(Category.COFFEE, List.of("Starbucks", "Costa Coffee", "Insomnia", "Bewleys", "3FE Coffee",
                "Kaph", "Two Boys Brew", "Clement & Pekoe"));
        MERCHANTS.put(Category.GROCERIES, List.of("Tesco", "Dunnes Stores", "Lidl", "Aldi", "SuperValu",
                "Marks & Spencer", "Centra", "Spar", "Fresh"));
        MERCHANTS.put(Category.DINING, List.of("Nandos", "Five Guys", "Bunsen", "The Brazen Head", "Fade Street Social",
                "Wowburger", "Elephant & Castle", "Boojum", "Chipotle", "Wagamama"));
        MERCHANTS.put(Category.TRANSPORT, List.of("Uber", "Bolt", "Dublin Bus", "Luas", "Irish Rail", "FreeNow",
                "Leap Card Top-up", "Circle K Fuel", "Applegreen"));
        MERCHANTS.put(Category.SHOPPING, List.of("Penneys", "Brown Thomas", "Arnotts", "Amazon", "ASOS", "Zara",
                "H&M", "TK Maxx", "Lifestyle Sports"));
        MERCHANTS.put(Category.SUBSCRIPTIONS, List.of("Netflix", "Spotify", "Disney+", "Amazon Prime", "Gym Plus",
                "Adobe", "iCloud", "YouTube Premium", "Headspace"));
        MERCHANTS.put(Category.UTILITIES, List.of("Electric Ireland", "Bord Gais", "Virgin Media", "Three Ireland",
                "Eir", "Irish Water", "Vodafone"));
        MERCHANTS.put(Category.ENTERTAINMENT, List.of("Cineworld", "Odeon", "Ticketmaster", "Eventbrite",
                "PlayStation Store", "Steam", "Lighthouse Cinema", "The Stella"));
        MERCHANTS.put(Category.RENT, List.of("AIB Rent Transfer", "Bank Transfer - Rent", "Landlord Payment",
                "Property Management"));
        MERCHANTS.put(Category.TRANSFER, List.of("Revolut Transfer", "AIB Transfer", "Bank Transfer", "N26 Transfer"));
        MERCHANTS.put(Category.HEALTHCARE, List.of("Boots Pharmacy", "Lloyds Pharmacy", "VHI", "Irish Life",
                "GP Visit", "Dental Care"));
        MERCHANTS.put(Category.EDUCATION, List.of("Udemy", "Coursera", "Skillshare", "LinkedIn Learning",
                "Book Depository"));
        MERCHANTS.put(Category.INCOME, List.of("Salary - Direct Deposit", "Employer Payment", "Payroll",
                "Freelance Payment", "Bonus Payment"));
    }

    private MerchantCatalog() {
    }

    public static List<String> merchantsFor(Category category) {
        return MERCHANTS.getOrDefault(category, List.of());
    }

    public static String pick(Category category, RandomSource random) {
        List<String> merchants = merchantsFor(category);
        if (merchants.isEmpty()) {
            return category.label();
        }
        return random.pick(merchants);
    }
}
